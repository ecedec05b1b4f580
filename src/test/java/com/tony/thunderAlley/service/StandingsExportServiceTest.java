package com.tony.thunderAlley.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.tony.thunderAlley.config.LeagueProperties;
import com.tony.thunderAlley.model.DriverStanding;
import com.tony.thunderAlley.model.OwnerStanding;
import com.tony.thunderAlley.model.PlayoffStanding;
import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.model.ScoredResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StandingsExportServiceTest {

    @TempDir
    Path tempDir;

    private StandingsExportService exportService;

    @BeforeEach
    void setUp() {
        LeagueProperties properties = new LeagueProperties();
        properties.setExportDir(tempDir.toString());
        properties.setSeason(3);
        exportService = new StandingsExportService(properties);
    }

    @Test
    @DisplayName("CSV de saison : une ligne par voiture et par course, DNQ en toutes lettres")
    void seasonResultsOneRowPerCarPerRace() throws Exception {
        ScoredResult winner = ScoredResult.builder()
                .finish(1).carNumber(31).driver("Ava").team("Green").startingPos(1)
                .turnsLed(8).points(48).playoffPoints(5).relativeFinish(1).qualifyingPoints(14)
                .build();
        ScoredResult dnq = ScoredResult.builder()
                .finish(null).carNumber(32).driver("Ben").team("Green").startingPos(null).points(1)
                .build();
        Race race = new Race(LocalDate.of(2024, 5, 26), 7, "darlington", List.of(winner, dnq), List.of());

        Path file = exportService.writeSeasonResults(List.of(race));

        assertThat(file).isEqualTo(tempDir.resolve("season").resolve("season_3_results.csv"));
        List<String[]> rows = read(file);
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).containsExactly(StandingsExportService.SEASON_HEADER);
        assertThat(rows.get(1)).containsExactly("2024-05-26", "7", "darlington", "1", "31", "Ava", "Green",
                "1", "8", "48", "5", "1", "14");
        assertThat(rows.get(2)[3]).isEqualTo("DNQ");
        assertThat(rows.get(2)[7]).isEqualTo("DNQ");
    }

    @Test
    @DisplayName("Classements : trois fichiers, propriétaire absent laissé vide, marge de playoffs reprise telle quelle")
    void standingsFiles() throws Exception {
        DriverStanding driver = DriverStanding.builder()
                .position(1).carNumber(31).driver("Ava").team("Green").points(120).behind(0)
                .starts(3).wins(2).top5s(3).top10s(3).turnsLed(40).playoffPoints(14)
                .build();
        OwnerStanding owner = OwnerStanding.builder()
                .position(1).owner(null).team("Black").points(300).behind(0).wins(2).top5s(5).top10s(8)
                .build();
        PlayoffStanding playoff = PlayoffStanding.builder()
                .position(1).carNumber(31).driver("Ava").team("Green").playoffPoints(14)
                .wins(2).top5s(3).top10s(3).turnsLed(40).margin("+6")
                .build();

        exportService.writeStandings(List.of(driver), List.of(owner), List.of(playoff));

        Path dir = exportService.seasonDir();
        List<String[]> drivers = read(dir.resolve("driver_standings.csv"));
        List<String[]> owners = read(dir.resolve("owner_standings.csv"));
        List<String[]> playoffs = read(dir.resolve("playoff_standings.csv"));

        assertThat(drivers.get(0)).containsExactly(StandingsExportService.DRIVER_HEADER);
        assertThat(drivers.get(1)).containsExactly("1", "31", "Ava", "Green", "120", "0", "3", "2", "3", "3", "40", "14");
        assertThat(owners.get(1)[1]).isEmpty();
        assertThat(owners.get(1)[2]).isEqualTo("Black");
        assertThat(playoffs.get(0)).containsExactly(StandingsExportService.PLAYOFF_HEADER);
        assertThat(playoffs.get(1)[9]).isEqualTo("+6");
    }

    @Test
    @DisplayName("Saison vide : fichiers réduits à l'en-tête")
    void emptySeasonWritesHeadersOnly() throws Exception {
        exportService.writeSeasonResults(List.of());
        exportService.writeStandings(List.of(), List.of(), List.of());

        assertThat(read(exportService.seasonResultsFile())).hasSize(1);
        List<String[]> owners = read(exportService.seasonDir().resolve("owner_standings.csv"));
        assertThat(owners).hasSize(1);
        assertThat(owners.get(0)).containsExactly(StandingsExportService.OWNER_HEADER);
    }

    private static List<String[]> read(Path file) throws IOException, CsvException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(in)) {
            return csv.readAll();
        }
    }
}
