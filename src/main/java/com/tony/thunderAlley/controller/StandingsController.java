package com.tony.thunderAlley.controller;

import com.tony.thunderAlley.model.DriverStanding;
import com.tony.thunderAlley.model.OwnerStanding;
import com.tony.thunderAlley.model.PlayoffStanding;
import com.tony.thunderAlley.service.StandingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/standings")
@RequiredArgsConstructor
@Slf4j
public class StandingsController {

    private final StandingsService standingsService;

    @GetMapping("/drivers")
    public ResponseEntity<List<DriverStanding>> getDriverStandings() {
        return ResponseEntity.ok(standingsService.getDriverStandings());
    }

    @GetMapping("/owners")
    public ResponseEntity<List<OwnerStanding>> getOwnerStandings() {
        return ResponseEntity.ok(standingsService.getOwnerStandings());
    }

    @GetMapping("/playoffs")
    public ResponseEntity<List<PlayoffStanding>> getPlayoffStandings() {
        return ResponseEntity.ok(standingsService.getPlayoffStandings());
    }

    @PostMapping("/recalculate")
    public ResponseEntity<Map<String, String>> recalculate() {
        log.info("🔄 Recalcul manuel des classements");
        standingsService.recalculateAndExport();
        return ResponseEntity.ok(Map.of("message", "Classements recalculés et exportés."));
    }
}
