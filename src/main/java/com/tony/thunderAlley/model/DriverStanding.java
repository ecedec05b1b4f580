package com.tony.thunderAlley.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriverStanding {
    private int position;
    private int carNumber;
    private String driver;
    private String team;
    private int points;
    private int behind; // écart avec le leader
    private int starts;
    private int wins;
    private int top5s;
    private int top10s;
    private int turnsLed;
    private int playoffPoints;
}
