package com.tony.thunderAlley.service;

import com.tony.thunderAlley.model.FinishInput;
import com.tony.thunderAlley.model.GridEntry;
import com.tony.thunderAlley.model.PointsStructure;
import com.tony.thunderAlley.model.ScoredRace;
import com.tony.thunderAlley.model.ScoredResult;
import com.tony.thunderAlley.model.TeamRaceResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ResultScorer {

    // Bonus de qualification du poleman, indépendant du résultat de course
    public static final int POLE_QUALIFYING_BONUS = 4;

    // Bonus d'écurie pour le plus grand nombre de tours menés
    public static final int MOST_LED_TEAM_BONUS = 1;

    /**
     * Combine la grille de départ et l'arrivée saisie en résultats notés.
     * <ul>
     *   <li>DNQ : barèmes "DNQ", 0 tour mené, pas de position de départ ni d'arrivée relative.</li>
     *   <li>Classé : points du barème + tours menés ; points de qualification + 4 au poleman ;
     *       arrivée relative = rang parmi les coéquipiers classés.</li>
     * </ul>
     *
     * @throws NoSuchElementException si une arrivée référence une voiture absente de la grille
     */
    public ScoredRace score(List<GridEntry> grid, List<FinishInput> finishes, PointsStructure points) {
        Map<Integer, GridEntry> gridByCar = grid.stream()
                .collect(Collectors.toMap(GridEntry::getCarNumber, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        // 1. Arrivées triées par écurie + tours menés cumulés (classés uniquement)
        Map<String, List<Integer>> teamFinishes = new LinkedHashMap<>();
        Map<String, Integer> teamTurnsLed = new LinkedHashMap<>();
        for (FinishInput finish : finishes) {
            GridEntry entry = lookup(gridByCar, finish.getCarNumber());
            if (finish.isDnq()) continue;
            teamFinishes.computeIfAbsent(entry.getTeam(), t -> new ArrayList<>()).add(finish.getFinish());
            teamTurnsLed.merge(entry.getTeam(), finish.getTurnsLed(), Integer::sum);
        }
        teamFinishes.values().forEach(list -> list.sort(Comparator.naturalOrder()));

        // 2. Notation voiture par voiture, dans l'ordre de saisie
        List<ScoredResult> results = new ArrayList<>(finishes.size());
        for (FinishInput finish : finishes) {
            GridEntry entry = lookup(gridByCar, finish.getCarNumber());
            results.add(finish.isDnq()
                    ? dnqResult(entry, points)
                    : finisherResult(entry, finish, points, teamFinishes.get(entry.getTeam())));
        }

        Optional<String> mostLed = mostLedTeam(teamTurnsLed);
        log.debug("Course notée : {} résultats, écurie la plus en tête : {}", results.size(), mostLed.orElse("aucune"));
        return new ScoredRace(results, mostLed);
    }

    /**
     * Bilan par écurie d'une course notée : total de points (+1 pour l'écurie qui a mené le plus),
     * tours menés, arrivée moyenne des classés, nombre de voitures, puis classement par total décroissant.
     */
    public List<TeamRaceResult> teamResults(ScoredRace race) {
        Map<String, List<ScoredResult>> byTeam = new LinkedHashMap<>();
        race.results().forEach(r -> byTeam.computeIfAbsent(r.getTeam(), t -> new ArrayList<>()).add(r));

        List<TeamRaceResult> teams = new ArrayList<>();
        for (Map.Entry<String, List<ScoredResult>> entry : byTeam.entrySet()) {
            List<ScoredResult> rows = entry.getValue();
            int total = rows.stream().mapToInt(ScoredResult::getPoints).sum();
            if (race.mostLedTeam().filter(entry.getKey()::equals).isPresent()) {
                total += MOST_LED_TEAM_BONUS;
            }
            double avgFinish = rows.stream()
                    .filter(r -> !r.isDnq())
                    .mapToInt(ScoredResult::getFinish)
                    .average()
                    .orElse(0.0);

            teams.add(TeamRaceResult.builder()
                    .team(entry.getKey())
                    .totalPoints(total)
                    .turnsLed(rows.stream().mapToInt(ScoredResult::getTurnsLed).sum())
                    .avgFinish(round(avgFinish))
                    .drivers(rows.size())
                    .build());
        }

        // List.sort est stable : à égalité, l'ordre d'apparition est conservé
        teams.sort(Comparator.comparingInt(TeamRaceResult::getTotalPoints).reversed());
        int position = 1;
        for (TeamRaceResult team : teams) {
            team.setPosition(position++);
        }
        return teams;
    }

    static int qualifyingPoints(int finish, int startingPos, PointsStructure points) {
        int qualifying = points.qualifyingPointsFor(String.valueOf(finish));
        if (startingPos == 1) {
            qualifying += POLE_QUALIFYING_BONUS;
        }
        return qualifying;
    }

    // Strictement le plus de tours menés, et au moins un ; à égalité la première écurie rencontrée
    private static Optional<String> mostLedTeam(Map<String, Integer> teamTurnsLed) {
        String best = null;
        int bestTurns = 0;
        for (Map.Entry<String, Integer> entry : teamTurnsLed.entrySet()) {
            if (entry.getValue() > bestTurns) {
                best = entry.getKey();
                bestTurns = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private static ScoredResult dnqResult(GridEntry entry, PointsStructure points) {
        return ScoredResult.builder()
                .finish(null)
                .carNumber(entry.getCarNumber())
                .driver(entry.getDriver())
                .team(entry.getTeam())
                .startingPos(null)
                .turnsLed(0)
                .points(points.racePointsFor(PointsStructure.DNQ_KEY))
                .playoffPoints(points.playoffPointsFor(PointsStructure.DNQ_KEY))
                .relativeFinish(0)
                .qualifyingPoints(points.qualifyingPointsFor(PointsStructure.DNQ_KEY))
                .build();
    }

    private static ScoredResult finisherResult(GridEntry entry, FinishInput finish, PointsStructure points,
                                               List<Integer> sortedTeamFinishes) {
        int position = finish.getFinish();
        String key = String.valueOf(position);
        return ScoredResult.builder()
                .finish(position)
                .carNumber(entry.getCarNumber())
                .driver(entry.getDriver())
                .team(entry.getTeam())
                .startingPos(entry.getStartingPosition())
                .turnsLed(finish.getTurnsLed())
                .points(points.racePointsFor(key) + finish.getTurnsLed())
                .playoffPoints(points.playoffPointsFor(key))
                .relativeFinish(sortedTeamFinishes.indexOf(position) + 1)
                .qualifyingPoints(qualifyingPoints(position, entry.getStartingPosition(), points))
                .build();
    }

    private static GridEntry lookup(Map<Integer, GridEntry> gridByCar, int carNumber) {
        GridEntry entry = gridByCar.get(carNumber);
        if (entry == null) {
            throw new NoSuchElementException("Voiture #" + carNumber + " absente de la grille de départ");
        }
        return entry;
    }

    private static double round(double val) { return Math.round(val * 100.0) / 100.0; }
}
