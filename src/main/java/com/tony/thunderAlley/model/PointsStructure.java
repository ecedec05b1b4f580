package com.tony.thunderAlley.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Barèmes de points indexés par position d'arrivée ("1", "2", ...) ou par la clé littérale "DNQ".
 * Toute clé absente vaut 0.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PointsStructure {

    public static final String DNQ_KEY = "DNQ";

    private Map<String, Integer> points = new HashMap<>();
    private Map<String, Integer> playoffPoints = new HashMap<>();
    private Map<String, Integer> qualifyingPoints = new HashMap<>();

    public int racePointsFor(String key) {
        return lookup(points, key);
    }

    public int playoffPointsFor(String key) {
        return lookup(playoffPoints, key);
    }

    public int qualifyingPointsFor(String key) {
        return lookup(qualifyingPoints, key);
    }

    private static int lookup(Map<String, Integer> table, String key) {
        if (table == null) return 0;
        Integer value = table.get(key);
        return value != null ? value : 0;
    }
}
