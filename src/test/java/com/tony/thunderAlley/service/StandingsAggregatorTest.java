package com.tony.thunderAlley.service;

import com.tony.thunderAlley.model.DriverStanding;
import com.tony.thunderAlley.model.OwnerStanding;
import com.tony.thunderAlley.model.PlayoffStanding;
import com.tony.thunderAlley.model.ScoredResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StandingsAggregatorTest {

    private StandingsAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new StandingsAggregator();
    }

    @Test
    @DisplayName("Écart au cutline en chiffres ASCII quelle que soit la locale par défaut")
    void playoffMarginIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("ar-EG"));
        try {
            List<PlayoffStanding> standings = aggregator.playoffStandings(field(13));

            assertThat(standings.get(0).getMargin()).isEqualTo("+12");
            assertThat(standings.get(12).getMargin()).isEqualTo("-1");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Classement pilotes : cumul sur la saison, écart au leader, DNQ hors départs et tops")
    void driverStandingsAccumulateSeason() {
        List<ScoredResult> history = List.of(
                // Course 1
                finisher(1, "Ava", "A", 1, 50, 5, 10),
                finisher(2, "Ben", "A", 2, 35, 4, 0),
                // Course 2
                dnq(1, "Ava", "A", 1),
                finisher(2, "Ben", "A", 1, 40, 5, 0));

        List<DriverStanding> standings = aggregator.driverStandings(history);

        DriverStanding ben = standings.get(0);
        DriverStanding ava = standings.get(1);
        assertThat(ben.getCarNumber()).isEqualTo(2);
        assertThat(ben.getPosition()).isEqualTo(1);
        assertThat(ben.getPoints()).isEqualTo(75);
        assertThat(ben.getBehind()).isZero();
        assertThat(ben.getStarts()).isEqualTo(2);
        assertThat(ben.getWins()).isEqualTo(1);
        assertThat(ben.getPlayoffPoints()).isEqualTo(9);

        assertThat(ava.getPosition()).isEqualTo(2);
        assertThat(ava.getPoints()).isEqualTo(51);
        assertThat(ava.getBehind()).isEqualTo(24);
        assertThat(ava.getStarts()).isEqualTo(1);
        assertThat(ava.getWins()).isEqualTo(1);
        assertThat(ava.getTop5s()).isEqualTo(1);
        assertThat(ava.getTop10s()).isEqualTo(1);
        assertThat(ava.getTurnsLed()).isEqualTo(10);
    }

    @Test
    @DisplayName("À points égaux : victoires, puis top 5, top 10, tours menés ; sinon ordre d'apparition")
    void driverTieBreakers() {
        List<ScoredResult> history = List.of(
                finisher(1, "Ava", "A", 6, 30, 0, 0),
                finisher(2, "Ben", "A", 1, 30, 0, 0),
                finisher(3, "Cleo", "B", 12, 30, 0, 5),
                finisher(4, "Dax", "B", 12, 30, 0, 0),
                finisher(5, "Eli", "B", 12, 30, 0, 0));

        List<DriverStanding> standings = aggregator.driverStandings(history);

        assertThat(standings).extracting(DriverStanding::getCarNumber).containsExactly(2, 1, 3, 4, 5);
        assertThat(standings).extracting(DriverStanding::getPosition).containsExactly(1, 2, 3, 4, 5);
        assertThat(standings).extracting(DriverStanding::getBehind).containsOnly(0);
    }

    @Test
    @DisplayName("Classement propriétaires : par écurie, propriétaire absent = null")
    void ownerStandingsGroupByTeam() {
        List<ScoredResult> history = List.of(
                finisher(1, "Ava", "A", 1, 40, 5, 0),
                finisher(11, "Dax", "B", 2, 35, 4, 0),
                finisher(2, "Ben", "A", 3, 34, 3, 0),
                dnq(12, "Eli", "B", 1));
        Map<String, String> owners = new HashMap<>();
        owners.put("A", "Alice Owner");
        owners.put("B", null);

        List<OwnerStanding> standings = aggregator.ownerStandings(history, owners);

        assertThat(standings).extracting(OwnerStanding::getTeam).containsExactly("A", "B");
        assertThat(standings.get(0).getOwner()).isEqualTo("Alice Owner");
        assertThat(standings.get(0).getPoints()).isEqualTo(74);
        assertThat(standings.get(0).getWins()).isEqualTo(1);
        assertThat(standings.get(0).getTop5s()).isEqualTo(2);
        assertThat(standings.get(1).getOwner()).isNull();
        assertThat(standings.get(1).getPoints()).isEqualTo(36);
        assertThat(standings.get(1).getBehind()).isEqualTo(38);
    }

    @Test
    @DisplayName("Playoffs : marge vide tant qu'il y a 12 pilotes ou moins")
    void playoffMarginBlankUnderThirteen() {
        List<PlayoffStanding> standings = aggregator.playoffStandings(field(12));

        assertThat(standings).hasSize(12);
        assertThat(standings).extracting(PlayoffStanding::getMargin).containsOnly("");
    }

    @Test
    @DisplayName("Playoffs : marge signée par rapport au 13e (qualifiés) ou au 12e (éliminés)")
    void playoffMarginAgainstCutline() {
        // Pilote i a 14 - i points de playoffs : 13, 12, ..., 1
        List<PlayoffStanding> standings = aggregator.playoffStandings(field(13));

        assertThat(standings.get(0).getPlayoffPoints()).isEqualTo(13);
        assertThat(standings.get(0).getMargin()).isEqualTo("+12");
        assertThat(standings.get(11).getMargin()).isEqualTo("+1");
        assertThat(standings.get(12).getMargin()).isEqualTo("-1");
    }

    @Test
    @DisplayName("Playoffs : égalité sur la cutline affichée +0")
    void playoffMarginZeroOnTie() {
        List<ScoredResult> history = new ArrayList<>(field(11));
        history.add(finisher(40, "Tie One", "C", 20, 1, 1, 0));
        history.add(finisher(41, "Tie Two", "C", 20, 1, 1, 0));

        List<PlayoffStanding> standings = aggregator.playoffStandings(history);

        assertThat(standings.get(11).getMargin()).isEqualTo("+0");
        assertThat(standings.get(12).getMargin()).isEqualTo("+0");
    }

    @Test
    @DisplayName("Playoffs : seuls les 24 premiers sont renvoyés")
    void playoffStandingsTruncatedToTwentyFour() {
        List<PlayoffStanding> standings = aggregator.playoffStandings(field(30));

        assertThat(standings).hasSize(StandingsAggregator.PLAYOFF_DISPLAY_LIMIT);
        assertThat(standings.get(23).getPosition()).isEqualTo(24);
    }

    @Test
    @DisplayName("Historique vide : classements vides")
    void emptyHistoryGivesEmptyStandings() {
        assertThat(aggregator.driverStandings(List.of())).isEmpty();
        assertThat(aggregator.ownerStandings(List.of(), Map.of())).isEmpty();
        assertThat(aggregator.playoffStandings(List.of())).isEmpty();
    }

    // n pilotes, le i-ème (1-based) avec n + 1 - i points de playoffs, tous arrivés hors top 10
    private static List<ScoredResult> field(int n) {
        List<ScoredResult> history = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            history.add(finisher(100 + i, "Driver " + i, "T" + (i % 3), 20, 1, n + 1 - i, 0));
        }
        return history;
    }

    private static ScoredResult finisher(int car, String driver, String team, int finish,
                                         int points, int playoffPoints, int turnsLed) {
        return ScoredResult.builder()
                .finish(finish).carNumber(car).driver(driver).team(team)
                .startingPos(1).turnsLed(turnsLed)
                .points(points).playoffPoints(playoffPoints)
                .relativeFinish(1).qualifyingPoints(0)
                .build();
    }

    private static ScoredResult dnq(int car, String driver, String team, int points) {
        return ScoredResult.builder()
                .finish(null).carNumber(car).driver(driver).team(team)
                .startingPos(null).points(points)
                .build();
    }
}
