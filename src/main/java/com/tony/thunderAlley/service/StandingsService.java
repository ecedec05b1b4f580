package com.tony.thunderAlley.service;

import com.tony.thunderAlley.config.LeagueConfigLoader;
import com.tony.thunderAlley.model.DriverStanding;
import com.tony.thunderAlley.model.OwnerStanding;
import com.tony.thunderAlley.model.PlayoffStanding;
import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.model.ScoredResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class StandingsService {

    private final SeasonStore seasonStore;
    private final StandingsAggregator aggregator;
    private final LeagueConfigLoader configLoader;
    private final StandingsExportService exportService;

    public List<DriverStanding> getDriverStandings() {
        return aggregator.driverStandings(seasonStore.loadHistory());
    }

    public List<OwnerStanding> getOwnerStandings() {
        return aggregator.ownerStandings(seasonStore.loadHistory(), configLoader.load().getTeamOwners());
    }

    public List<PlayoffStanding> getPlayoffStandings() {
        return aggregator.playoffStandings(seasonStore.loadHistory());
    }

    /**
     * Recalcule les trois classements depuis le store et réécrit tous les CSV de saison.
     * À appeler après chaque course enregistrée ou import d'archive.
     */
    public void recalculateAndExport() {
        List<Race> races = seasonStore.loadRaces();
        List<ScoredResult> history = races.stream().flatMap(r -> r.getResults().stream()).toList();

        exportService.writeSeasonResults(races);
        exportService.writeStandings(
                aggregator.driverStandings(history),
                aggregator.ownerStandings(history, configLoader.load().getTeamOwners()),
                aggregator.playoffStandings(history));
        log.info("🏆 Classements recalculés sur {} courses ({} résultats)", races.size(), history.size());
    }
}
