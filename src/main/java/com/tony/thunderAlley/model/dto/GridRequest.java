package com.tony.thunderAlley.model.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GridRequest {
    @NotEmpty(message = "Au moins deux écuries sont requises")
    private List<String> teams;
}
