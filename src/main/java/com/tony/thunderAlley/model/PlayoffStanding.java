package com.tony.thunderAlley.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayoffStanding {
    private int position;
    private int carNumber;
    private String driver;
    private String team;
    private int playoffPoints;
    private int wins;
    private int top5s;
    private int top10s;
    private int turnsLed;

    // Écart à la cutline, signé ("+7", "-3", "+0") ; vide tant qu'il y a moins de 13 pilotes
    @Builder.Default
    private String margin = "";
}
