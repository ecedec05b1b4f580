package com.tony.thunderAlley.config;

import com.tony.thunderAlley.model.GridFillPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "league")
@Data
public class LeagueProperties {
    // --- Fichiers de configuration statique (drivers, owners, pole, tracks, points) ---
    private String configLocation = "classpath:league/";

    // --- Exports (archive JSON brute + CSV de saison) ---
    private String exportDir = "./data";
    private boolean archiveEnabled = true;

    // Numéro de saison, utilisé pour nommer le CSV de saison
    private int season = 2;

    private GridFillPolicy gridFillPolicy = GridFillPolicy.FILL_RANDOM;
}
