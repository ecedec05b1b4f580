package com.tony.thunderAlley.config;

import com.tony.thunderAlley.model.LeagueConfig;
import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.service.SeasonStore;
import com.tony.thunderAlley.service.StandingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {
    private final LeagueConfigLoader configLoader;
    private final LeagueProperties properties;
    private final SeasonStore seasonStore;
    private final StandingsService standingsService;

    @Override
    public void run(String... args) {
        LeagueConfig config = configLoader.load();
        log.info("🌱 Ligue chargée : {} voitures, {} écuries, {} circuits (saison {})",
                config.getDrivers().size(), config.getTeamOwners().size(), config.getTracks().size(), properties.getSeason());

        List<Race> races = seasonStore.loadRaces();
        if (races.isEmpty()) {
            log.info("Aucune course enregistrée : la première grille sera tirée au hasard.");
            return;
        }

        // On remet les CSV de saison en phase avec la base au démarrage
        if (properties.isArchiveEnabled()) {
            log.info("🔄 Recalcul des classements sur {} courses...", races.size());
            standingsService.recalculateAndExport();
        }
    }
}
