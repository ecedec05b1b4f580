package com.tony.thunderAlley.model.dto;

import com.tony.thunderAlley.model.GridEntry;
import com.tony.thunderAlley.model.Qualifier;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class GridResponse {
    private int carsPerTeam;
    private boolean coldStart; // true pour la première course (aucun historique)
    private List<Qualifier> qualifiers;
    private List<GridEntry> grid;
}
