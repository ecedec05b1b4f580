package com.tony.thunderAlley.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OwnerStanding {
    private int position;
    private String owner; // null si l'écurie n'a pas de propriétaire
    private String team;
    private int points;
    private int behind;
    private int wins;
    private int top5s;
    private int top10s;
}
