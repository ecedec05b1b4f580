package com.tony.thunderAlley.model;

import java.util.List;
import java.util.Optional;

/**
 * Sortie du scoring d'une course : les résultats par voiture et l'écurie ayant mené le plus de tours
 * (absente si aucune écurie n'a mené).
 */
public record ScoredRace(List<ScoredResult> results, Optional<String> mostLedTeam) {

    public ScoredRace {
        results = List.copyOf(results);
    }
}
