package com.tony.thunderAlley.service;

import com.tony.thunderAlley.model.Car;
import com.tony.thunderAlley.model.GridEntry;
import com.tony.thunderAlley.model.GridFillPolicy;
import com.tony.thunderAlley.model.Qualifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Slf4j
public class GridBuilder {

    /**
     * Nombre de voitures par écurie selon le nombre d'écuries engagées (règle d'équilibre fixe).
     */
    public static int carsPerTeam(int numTeams) {
        return switch (numTeams) {
            case 2 -> 6;
            case 3 -> 5;
            case 4 -> 4;
            default -> 3;
        };
    }

    /**
     * Écuries engagées triées par rang de pole croissant (tri stable).
     * Une écurie absente de la table de pole passe en dernier, dans l'ordre fourni.
     */
    public static List<String> poleOrder(List<String> teams, Map<String, Integer> polePosition) {
        return teams.stream()
                .distinct()
                .sorted(Comparator.comparingInt(team -> polePosition.getOrDefault(team, Integer.MAX_VALUE)))
                .toList();
    }

    public List<GridEntry> build(List<String> teams, Map<String, Integer> polePosition,
                                 List<Qualifier> qualifiers, List<Car> roster, GridFillPolicy policy) {
        return build(teams, polePosition, qualifiers, roster, policy, new Random());
    }

    /**
     * Construit la grille de départ en alternant les écuries dans l'ordre de pole, rang par rang.
     * <p>
     * Sans qualifiés (première course), chaque écurie aligne un tirage uniforme de son roster.
     * Sinon ses qualifiés occupent les premiers rangs, et selon {@code policy} les rangs restants
     * sont complétés au hasard ou laissés vides.
     *
     * @return la grille, positions 1..N sans trou ; vide si aucune écurie ou aucun roster
     */
    public List<GridEntry> build(List<String> teams, Map<String, Integer> polePosition,
                                 List<Qualifier> qualifiers, List<Car> roster,
                                 GridFillPolicy policy, Random random) {
        if (teams == null || teams.isEmpty()) {
            return List.of();
        }

        int carsPerTeam = carsPerTeam(teams.size());
        List<String> poleTeams = poleOrder(teams, polePosition);
        boolean coldStart = qualifiers == null || qualifiers.isEmpty();

        Map<String, List<Car>> selections = new LinkedHashMap<>();
        for (String team : poleTeams) {
            List<Car> teamRoster = roster.stream().filter(c -> team.equals(c.team())).toList();
            List<Car> selected = coldStart
                    ? sample(teamRoster, carsPerTeam, random)
                    : fromQualifiers(team, teamRoster, qualifiers, carsPerTeam, policy, random);
            selections.put(team, selected);
        }

        List<GridEntry> grid = interleave(poleTeams, selections, carsPerTeam);
        log.info("🏁 Grille construite ({}) : {} voitures, {} écuries, {} par écurie",
                coldStart ? "tirage initial" : "qualifications", grid.size(), poleTeams.size(), carsPerTeam);
        return grid;
    }

    private List<Car> fromQualifiers(String team, List<Car> teamRoster, List<Qualifier> qualifiers,
                                     int carsPerTeam, GridFillPolicy policy, Random random) {
        List<Car> selected = qualifiers.stream()
                .filter(q -> team.equals(q.team()))
                .sorted(Comparator.comparingInt(Qualifier::teamPosition))
                .limit(carsPerTeam)
                .map(q -> new Car(q.carNumber(), q.driver(), q.team()))
                .collect(Collectors.toCollection(ArrayList::new));

        int missing = carsPerTeam - selected.size();
        if (policy == GridFillPolicy.FILL_RANDOM && missing > 0) {
            Set<Integer> taken = selected.stream().map(Car::carNumber).collect(Collectors.toSet());
            List<Car> available = teamRoster.stream().filter(c -> !taken.contains(c.carNumber())).toList();
            selected.addAll(sample(available, missing, random));
        }
        return selected;
    }

    // Tirage uniforme sans remise ; l'ordre du tirage fixe l'ordre sur la grille
    private static List<Car> sample(List<Car> cars, int count, Random random) {
        List<Car> shuffled = new ArrayList<>(cars);
        Collections.shuffle(shuffled, random);
        return shuffled.subList(0, Math.min(count, shuffled.size()));
    }

    private static List<GridEntry> interleave(List<String> poleTeams, Map<String, List<Car>> selections, int carsPerTeam) {
        List<GridEntry> grid = new ArrayList<>();
        int position = 1;
        for (int rank = 0; rank < carsPerTeam; rank++) {
            for (String team : poleTeams) {
                List<Car> selected = selections.get(team);
                if (rank < selected.size()) {
                    Car car = selected.get(rank);
                    grid.add(new GridEntry(car.carNumber(), car.driver(), team, position++));
                }
            }
        }
        return grid;
    }
}
