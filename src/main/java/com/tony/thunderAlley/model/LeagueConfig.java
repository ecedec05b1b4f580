package com.tony.thunderAlley.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration statique de la ligue, telle que lue dans les fichiers JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeagueConfig {

    @Builder.Default
    private Map<Integer, DriverInfo> drivers = new LinkedHashMap<>();

    // Le propriétaire peut être null (écurie sans propriétaire)
    @Builder.Default
    private Map<String, String> teamOwners = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> polePosition = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Track> tracks = new LinkedHashMap<>();

    @Builder.Default
    private PointsStructure pointsStructure = new PointsStructure();

    /**
     * Roster complet trié par numéro de voiture.
     */
    public List<Car> roster() {
        return drivers.entrySet().stream()
                .map(e -> new Car(e.getKey(), e.getValue().getName(), e.getValue().getTeam()))
                .sorted(Comparator.comparingInt(Car::carNumber))
                .toList();
    }
}
