package com.tony.thunderAlley.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bilan d'une écurie sur une course.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TeamRaceResult {
    private int position;
    private String team;
    private int totalPoints;  // inclut le bonus +1 "most led"
    private int turnsLed;
    private double avgFinish; // moyenne des arrivées numériques, 0 si aucune
    private int drivers;
}
