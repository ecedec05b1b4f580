package com.tony.thunderAlley.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GridEntry {
    private int carNumber;
    private String driver;
    private String team;
    private int startingPosition; // 1..N, dense
}
