package com.tony.thunderAlley.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tony.thunderAlley.config.LeagueProperties;
import com.tony.thunderAlley.model.Race;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Archive brute des courses : un fichier JSON par course sous {exportDir}/raw/.
 * Sert aussi à importer une saison existante dans le store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RaceArchiveService {

    public static final String RAW_DIR = "raw";

    private final ObjectMapper objectMapper;
    private final LeagueProperties properties;
    private final SeasonStore seasonStore;

    public Path rawDir() {
        return Path.of(properties.getExportDir(), RAW_DIR);
    }

    public Path write(Race race) {
        Path path = rawDir().resolve(race.archiveFileName());
        try {
            Files.createDirectories(path.getParent());
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(path.toFile(), race);
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture impossible de " + path, e);
        }
        log.info("🗂️ Course archivée : {}", path);
        return path;
    }

    /** Relit les fichiers race_*.json de l'archive, triés par nom. */
    public List<Race> readAll() {
        Path dir = rawDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing
                    .filter(p -> p.getFileName().toString().startsWith("race_"))
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture impossible de " + dir, e);
        }

        List<Race> races = new ArrayList<>();
        for (Path file : files) {
            try {
                races.add(objectMapper.readValue(file.toFile(), Race.class));
            } catch (IOException e) {
                log.warn("⚠️ Fichier de course illisible ignoré : {} ({})", file, e.getMessage());
            }
        }
        return races;
    }

    /**
     * Importe dans le store les courses de l'archive qui n'y sont pas encore (clé : numéro de course).
     *
     * @return le nombre de courses importées
     */
    public int importArchive() {
        int imported = 0;
        int skipped = 0;
        List<Race> archived = readAll().stream()
                .sorted(Comparator.comparing(Race::getRaceNum, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        for (Race race : archived) {
            if (race.getRaceNum() == null || seasonStore.contains(race.getRaceNum())) {
                skipped++;
                continue;
            }
            seasonStore.append(race);
            imported++;
        }
        log.info("📥 Import de l'archive : {} courses importées, {} ignorées", imported, skipped);
        return imported;
    }
}
