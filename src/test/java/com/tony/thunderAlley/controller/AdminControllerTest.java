package com.tony.thunderAlley.controller;

import com.tony.thunderAlley.service.RaceArchiveService;
import com.tony.thunderAlley.service.StandingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AdminControllerTest {

    @Mock
    private RaceArchiveService archiveService;
    @Mock
    private StandingsService standingsService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new AdminController(archiveService, standingsService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
        when(archiveService.rawDir()).thenReturn(Path.of("data", "raw"));
    }

    @Test
    @DisplayName("Import de courses : classements recalculés")
    void importRecalculatesStandings() throws Exception {
        when(archiveService.importArchive()).thenReturn(3);

        mvc.perform(post("/api/v1/admin/import-archive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported").value(3));

        verify(standingsService).recalculateAndExport();
    }

    @Test
    @DisplayName("Rien de nouveau dans l'archive : pas de recalcul")
    void nothingImported() throws Exception {
        when(archiveService.importArchive()).thenReturn(0);

        mvc.perform(post("/api/v1/admin/import-archive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported").value(0));

        verifyNoInteractions(standingsService);
    }
}
