package com.tony.thunderAlley.service;

import com.tony.thunderAlley.model.DriverStanding;
import com.tony.thunderAlley.model.OwnerStanding;
import com.tony.thunderAlley.model.PlayoffStanding;
import com.tony.thunderAlley.model.ScoredResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Classements de saison (pilotes, propriétaires, playoffs) à partir de tous les résultats notés.
 * Chaque vue : regroupement, cumul, tri stable multi-critères décroissant, puis rang 1..N.
 */
@Service
public class StandingsAggregator {

    // Cutline playoffs : les 12 premiers sont qualifiés
    public static final int PLAYOFF_CUTLINE = 12;
    public static final int PLAYOFF_DISPLAY_LIMIT = 24;

    public List<DriverStanding> driverStandings(List<ScoredResult> history) {
        List<DriverStanding> rows = new ArrayList<>();
        groupBy(history, r -> new CarKey(r.getCarNumber(), r.getDriver(), r.getTeam())).forEach((car, results) -> {
            Totals t = Totals.of(results);
            rows.add(DriverStanding.builder()
                    .carNumber(car.carNumber())
                    .driver(car.driver())
                    .team(car.team())
                    .points(t.points)
                    .starts(t.starts)
                    .wins(t.wins)
                    .top5s(t.top5s)
                    .top10s(t.top10s)
                    .turnsLed(t.turnsLed)
                    .playoffPoints(t.playoffPoints)
                    .build());
        });

        int leader = rows.stream().mapToInt(DriverStanding::getPoints).max().orElse(0);
        rows.forEach(row -> row.setBehind(leader - row.getPoints()));

        // Points -> Victoires -> Top 5 -> Top 10 -> Tours menés
        rows.sort(Comparator.comparingInt(DriverStanding::getPoints)
                .thenComparingInt(DriverStanding::getWins)
                .thenComparingInt(DriverStanding::getTop5s)
                .thenComparingInt(DriverStanding::getTop10s)
                .thenComparingInt(DriverStanding::getTurnsLed)
                .reversed());

        int rank = 1;
        for (DriverStanding row : rows) {
            row.setPosition(rank++);
        }
        return rows;
    }

    public List<OwnerStanding> ownerStandings(List<ScoredResult> history, Map<String, String> teamOwners) {
        List<OwnerStanding> rows = new ArrayList<>();
        groupBy(history, ScoredResult::getTeam).forEach((team, results) -> {
            Totals t = Totals.of(results);
            rows.add(OwnerStanding.builder()
                    .team(team)
                    .owner(teamOwners != null ? teamOwners.get(team) : null)
                    .points(t.points)
                    .wins(t.wins)
                    .top5s(t.top5s)
                    .top10s(t.top10s)
                    .build());
        });

        int leader = rows.stream().mapToInt(OwnerStanding::getPoints).max().orElse(0);
        rows.forEach(row -> row.setBehind(leader - row.getPoints()));

        rows.sort(Comparator.comparingInt(OwnerStanding::getPoints)
                .thenComparingInt(OwnerStanding::getWins)
                .thenComparingInt(OwnerStanding::getTop5s)
                .thenComparingInt(OwnerStanding::getTop10s)
                .reversed());

        int rank = 1;
        for (OwnerStanding row : rows) {
            row.setPosition(rank++);
        }
        return rows;
    }

    /**
     * Classement playoffs avec marge signée par rapport à la cutline :
     * rangs 1-12 comparés au 13e, rangs 13+ comparés au 12e. Marge vide sous 13 pilotes.
     * Seuls les 24 premiers sont renvoyés.
     */
    public List<PlayoffStanding> playoffStandings(List<ScoredResult> history) {
        List<PlayoffStanding> rows = new ArrayList<>();
        groupBy(history, r -> new CarKey(r.getCarNumber(), r.getDriver(), r.getTeam())).forEach((car, results) -> {
            Totals t = Totals.of(results);
            rows.add(PlayoffStanding.builder()
                    .carNumber(car.carNumber())
                    .driver(car.driver())
                    .team(car.team())
                    .playoffPoints(t.playoffPoints)
                    .wins(t.wins)
                    .top5s(t.top5s)
                    .top10s(t.top10s)
                    .turnsLed(t.turnsLed)
                    .build());
        });

        rows.sort(Comparator.comparingInt(PlayoffStanding::getPlayoffPoints)
                .thenComparingInt(PlayoffStanding::getWins)
                .thenComparingInt(PlayoffStanding::getTop5s)
                .thenComparingInt(PlayoffStanding::getTop10s)
                .thenComparingInt(PlayoffStanding::getTurnsLed)
                .reversed());

        int rank = 1;
        for (PlayoffStanding row : rows) {
            row.setPosition(rank++);
        }

        if (rows.size() > PLAYOFF_CUTLINE) {
            int lastIn = rows.get(PLAYOFF_CUTLINE - 1).getPlayoffPoints();
            int firstOut = rows.get(PLAYOFF_CUTLINE).getPlayoffPoints();
            for (PlayoffStanding row : rows) {
                int delta = row.getPosition() <= PLAYOFF_CUTLINE
                        ? row.getPlayoffPoints() - firstOut
                        : row.getPlayoffPoints() - lastIn;
                row.setMargin(String.format(Locale.ROOT, "%+d", delta));
            }
        }

        return rows.size() > PLAYOFF_DISPLAY_LIMIT ? new ArrayList<>(rows.subList(0, PLAYOFF_DISPLAY_LIMIT)) : rows;
    }

    private static <K> Map<K, List<ScoredResult>> groupBy(List<ScoredResult> history, Function<ScoredResult, K> key) {
        Map<K, List<ScoredResult>> groups = new LinkedHashMap<>();
        if (history != null) {
            history.forEach(r -> groups.computeIfAbsent(key.apply(r), k -> new ArrayList<>()).add(r));
        }
        return groups;
    }

    private record CarKey(int carNumber, String driver, String team) {}

    // Cumuls communs aux trois vues ; un DNQ ne compte ni comme départ ni dans les tops
    private static final class Totals {
        int points;
        int playoffPoints;
        int turnsLed;
        int starts;
        int wins;
        int top5s;
        int top10s;

        static Totals of(List<ScoredResult> results) {
            Totals t = new Totals();
            for (ScoredResult r : results) {
                t.points += r.getPoints();
                t.playoffPoints += r.getPlayoffPoints();
                t.turnsLed += r.getTurnsLed();
                if (r.isDnq()) continue;
                t.starts++;
                if (r.getFinish() == 1) t.wins++;
                if (r.finishedWithin(5)) t.top5s++;
                if (r.finishedWithin(10)) t.top10s++;
            }
            return t;
        }
    }
}
