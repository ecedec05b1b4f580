package com.tony.thunderAlley.model.dto;

import com.tony.thunderAlley.model.FinishInput;
import com.tony.thunderAlley.model.GridEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Course jouée sur table : la grille renvoyée par /races/grid et l'ordre d'arrivée saisi par l'humain.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RaceSubmission {
    @NotEmpty
    private List<String> teams;

    @NotBlank(message = "Le circuit est requis")
    private String trackId;

    private LocalDate date; // aujourd'hui si absent

    @NotEmpty(message = "La grille de départ est requise")
    @Valid
    private List<GridEntry> grid;

    @NotEmpty(message = "L'ordre d'arrivée est requis")
    @Valid
    private List<FinishInput> finishes;
}
