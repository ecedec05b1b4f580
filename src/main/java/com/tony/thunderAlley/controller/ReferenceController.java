package com.tony.thunderAlley.controller;

import com.tony.thunderAlley.config.LeagueConfigLoader;
import com.tony.thunderAlley.model.Car;
import com.tony.thunderAlley.model.LeagueConfig;
import com.tony.thunderAlley.model.PointsStructure;
import com.tony.thunderAlley.model.Track;
import com.tony.thunderAlley.service.GridBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/references")
@RequiredArgsConstructor
public class ReferenceController {

    private final LeagueConfigLoader configLoader;

    // Écuries dans l'ordre de pole, avec leur propriétaire ; écuries sans pole en dernier
    @GetMapping("/teams")
    public ResponseEntity<Map<String, String>> getTeams() {
        LeagueConfig config = configLoader.load();
        Map<String, String> owners = config.getTeamOwners();
        Map<String, String> teams = new LinkedHashMap<>();
        for (String team : GridBuilder.poleOrder(List.copyOf(owners.keySet()), config.getPolePosition())) {
            teams.put(team, owners.get(team));
        }
        return ResponseEntity.ok(teams);
    }

    @GetMapping("/pole-position")
    public ResponseEntity<Map<String, Integer>> getPolePosition() {
        return ResponseEntity.ok(configLoader.load().getPolePosition());
    }

    @GetMapping("/tracks")
    public ResponseEntity<Map<String, Track>> getTracks() {
        return ResponseEntity.ok(configLoader.load().getTracks());
    }

    @GetMapping("/drivers")
    public ResponseEntity<List<Car>> getDrivers(@RequestParam(required = false) String team) {
        List<Car> roster = configLoader.load().roster();
        if (team != null) {
            roster = roster.stream().filter(c -> team.equals(c.team())).toList();
        }
        return ResponseEntity.ok(roster);
    }

    @GetMapping("/points")
    public ResponseEntity<PointsStructure> getPointsStructure() {
        return ResponseEntity.ok(configLoader.load().getPointsStructure());
    }
}
