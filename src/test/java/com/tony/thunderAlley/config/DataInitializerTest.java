package com.tony.thunderAlley.config;

import com.tony.thunderAlley.model.LeagueConfig;
import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.service.SeasonStore;
import com.tony.thunderAlley.service.StandingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataInitializerTest {

    @Mock
    private LeagueConfigLoader configLoader;
    @Mock
    private SeasonStore seasonStore;
    @Mock
    private StandingsService standingsService;

    private LeagueProperties properties;
    private DataInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = new LeagueProperties();
        initializer = new DataInitializer(configLoader, properties, seasonStore, standingsService);
        when(configLoader.load()).thenReturn(LeagueConfig.builder().build());
    }

    @Test
    @DisplayName("Saison vide au démarrage : aucun export")
    void emptySeasonSkipsExports() {
        when(seasonStore.loadRaces()).thenReturn(List.of());

        initializer.run();

        verifyNoInteractions(standingsService);
    }

    @Test
    @DisplayName("Courses en base au démarrage : CSV remis en phase")
    void existingSeasonRefreshesExports() {
        when(seasonStore.loadRaces()).thenReturn(List.of(new Race(LocalDate.of(2024, 2, 18), 1, "daytona", List.of(), List.of())));

        initializer.run();

        verify(standingsService).recalculateAndExport();
    }

    @Test
    @DisplayName("Exports désactivés : rien n'est réécrit")
    void archiveDisabled() {
        properties.setArchiveEnabled(false);
        when(seasonStore.loadRaces()).thenReturn(List.of(new Race(LocalDate.of(2024, 2, 18), 1, "daytona", List.of(), List.of())));

        initializer.run();

        verifyNoInteractions(standingsService);
    }
}
