package com.tony.thunderAlley.controller;

import com.tony.thunderAlley.service.RaceArchiveService;
import com.tony.thunderAlley.service.StandingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final RaceArchiveService archiveService;
    private final StandingsService standingsService;

    /**
     * Reprend une saison existante : importe les fichiers race_*.json de l'archive brute
     * qui ne sont pas encore en base, puis recalcule les classements.
     */
    @PostMapping("/import-archive")
    public ResponseEntity<Map<String, Object>> importArchive() {
        log.info("📥 Import de l'archive {} demandé par l'admin", archiveService.rawDir());
        int imported = archiveService.importArchive();
        if (imported > 0) {
            standingsService.recalculateAndExport();
        }
        return ResponseEntity.ok(Map.of("imported", imported));
    }
}
