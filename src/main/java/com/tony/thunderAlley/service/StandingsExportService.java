package com.tony.thunderAlley.service;

import com.opencsv.CSVWriter;
import com.tony.thunderAlley.config.LeagueProperties;
import com.tony.thunderAlley.model.DriverStanding;
import com.tony.thunderAlley.model.OwnerStanding;
import com.tony.thunderAlley.model.PlayoffStanding;
import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.model.ScoredResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports CSV de la saison sous {exportDir}/season/ : résultats aplatis et les trois classements.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StandingsExportService {

    public static final String SEASON_DIR = "season";

    static final String[] SEASON_HEADER = {"date", "raceNum", "trackId", "finish", "carNumber", "driver", "team",
            "startingPos", "turnsLed", "points", "playoffPoints", "relativeFinish", "qualifyingPoints"};
    static final String[] DRIVER_HEADER = {"position", "carNumber", "driver", "team", "points", "behind", "starts",
            "wins", "top5s", "top10s", "turnsLed", "playoffPoints"};
    static final String[] OWNER_HEADER = {"position", "owner", "team", "points", "behind", "wins", "top5s", "top10s"};
    static final String[] PLAYOFF_HEADER = {"position", "carNumber", "driver", "team", "playoffPoints", "wins",
            "top5s", "top10s", "turnsLed", "margin"};

    private final LeagueProperties properties;

    public Path seasonDir() {
        return Path.of(properties.getExportDir(), SEASON_DIR);
    }

    public Path seasonResultsFile() {
        return seasonDir().resolve("season_" + properties.getSeason() + "_results.csv");
    }

    /** Une ligne par voiture et par course. */
    public Path writeSeasonResults(List<Race> races) {
        List<String[]> rows = new ArrayList<>();
        for (Race race : races) {
            for (ScoredResult r : race.getResults()) {
                rows.add(new String[]{
                        String.valueOf(race.getDate()), String.valueOf(race.getRaceNum()), race.getTrackId(),
                        r.finishLabel(), String.valueOf(r.getCarNumber()), r.getDriver(), r.getTeam(),
                        r.startingPosLabel(), String.valueOf(r.getTurnsLed()), String.valueOf(r.getPoints()),
                        String.valueOf(r.getPlayoffPoints()), String.valueOf(r.getRelativeFinish()),
                        String.valueOf(r.getQualifyingPoints())
                });
            }
        }
        return write(seasonResultsFile(), SEASON_HEADER, rows);
    }

    public void writeStandings(List<DriverStanding> drivers, List<OwnerStanding> owners, List<PlayoffStanding> playoffs) {
        write(seasonDir().resolve("driver_standings.csv"), DRIVER_HEADER, drivers.stream().map(d -> new String[]{
                String.valueOf(d.getPosition()), String.valueOf(d.getCarNumber()), d.getDriver(), d.getTeam(),
                String.valueOf(d.getPoints()), String.valueOf(d.getBehind()), String.valueOf(d.getStarts()),
                String.valueOf(d.getWins()), String.valueOf(d.getTop5s()), String.valueOf(d.getTop10s()),
                String.valueOf(d.getTurnsLed()), String.valueOf(d.getPlayoffPoints())
        }).toList());

        write(seasonDir().resolve("owner_standings.csv"), OWNER_HEADER, owners.stream().map(o -> new String[]{
                String.valueOf(o.getPosition()), o.getOwner() != null ? o.getOwner() : "", o.getTeam(),
                String.valueOf(o.getPoints()), String.valueOf(o.getBehind()), String.valueOf(o.getWins()),
                String.valueOf(o.getTop5s()), String.valueOf(o.getTop10s())
        }).toList());

        write(seasonDir().resolve("playoff_standings.csv"), PLAYOFF_HEADER, playoffs.stream().map(p -> new String[]{
                String.valueOf(p.getPosition()), String.valueOf(p.getCarNumber()), p.getDriver(), p.getTeam(),
                String.valueOf(p.getPlayoffPoints()), String.valueOf(p.getWins()), String.valueOf(p.getTop5s()),
                String.valueOf(p.getTop10s()), String.valueOf(p.getTurnsLed()), p.getMargin()
        }).toList());

        log.info("📊 Classements exportés dans {} ({} pilotes, {} propriétaires)", seasonDir(), drivers.size(), owners.size());
    }

    private Path write(Path path, String[] header, List<String[]> rows) {
        try {
            Files.createDirectories(path.getParent());
            try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(out)) {
                csv.writeNext(header, false);
                for (String[] row : rows) {
                    csv.writeNext(row, false);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture impossible de " + path, e);
        }
        return path;
    }
}
