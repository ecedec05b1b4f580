package com.tony.thunderAlley.controller;

import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.model.dto.GridRequest;
import com.tony.thunderAlley.model.dto.GridResponse;
import com.tony.thunderAlley.model.dto.RaceSubmission;
import com.tony.thunderAlley.service.RaceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/races")
@RequiredArgsConstructor
public class RaceController {

    private final RaceService raceService;

    @GetMapping
    public ResponseEntity<List<Race>> getRaces() {
        return ResponseEntity.ok(raceService.getRaces());
    }

    // 1. Avant la course : qualifications + grille de départ
    @PostMapping("/grid")
    public ResponseEntity<GridResponse> prepareGrid(@Valid @RequestBody GridRequest request) {
        return ResponseEntity.ok(raceService.prepareGrid(request.getTeams()));
    }

    // 2. Après la course : l'arrivée saisie est notée et enregistrée
    @PostMapping
    public ResponseEntity<Race> recordRace(@Valid @RequestBody RaceSubmission submission) {
        return ResponseEntity.status(HttpStatus.CREATED).body(raceService.recordRace(submission));
    }
}
