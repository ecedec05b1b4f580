package com.tony.thunderAlley.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.thunderAlley.model.DriverInfo;
import com.tony.thunderAlley.model.LeagueConfig;
import com.tony.thunderAlley.model.PointsStructure;
import com.tony.thunderAlley.model.Track;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;

/**
 * Lit la configuration statique de la ligue (roster, propriétaires, pole, circuits, barèmes).
 * Les fichiers sont relus à chaque appel : une modification est prise en compte dès la course suivante.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LeagueConfigLoader {

    public static final String DRIVERS_FILE = "drivers.json";
    public static final String TEAM_OWNERS_FILE = "team_owners.json";
    public static final String POLE_POSITION_FILE = "pole_position.json";
    public static final String TRACKS_FILE = "tracks.json";
    public static final String POINTS_FILE = "points_structure.json";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final LeagueProperties properties;

    public LeagueConfig load() {
        LeagueConfig config = LeagueConfig.builder()
                .drivers(readSection(DRIVERS_FILE, "drivers", new TypeReference<LinkedHashMap<Integer, DriverInfo>>() {}))
                .teamOwners(readSection(TEAM_OWNERS_FILE, "teamOwners", new TypeReference<LinkedHashMap<String, String>>() {}))
                .polePosition(readSection(POLE_POSITION_FILE, "polePosition", new TypeReference<LinkedHashMap<String, Integer>>() {}))
                .tracks(readSection(TRACKS_FILE, "tracks", new TypeReference<LinkedHashMap<String, Track>>() {}))
                .pointsStructure(objectMapper.convertValue(readTree(POINTS_FILE), PointsStructure.class))
                .build();

        log.debug("Configuration chargée depuis {} : {} voitures, {} écuries, {} circuits",
                properties.getConfigLocation(), config.getDrivers().size(),
                config.getTeamOwners().size(), config.getTracks().size());
        return config;
    }

    private <T> T readSection(String fileName, String field, TypeReference<T> type) {
        JsonNode section = readTree(fileName).path(field);
        if (section.isMissingNode() || section.isNull()) {
            throw new IllegalStateException("Section '" + field + "' absente de " + fileName);
        }
        return objectMapper.convertValue(section, type);
    }

    private JsonNode readTree(String fileName) {
        Resource resource = resourceLoader.getResource(properties.getConfigLocation() + fileName);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture impossible de " + resource.getDescription(), e);
        }
    }
}
