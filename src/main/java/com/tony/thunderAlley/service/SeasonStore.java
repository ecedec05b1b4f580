package com.tony.thunderAlley.service;

import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.model.ScoredResult;

import java.util.List;

/**
 * Historique de la saison : lu en entier avant une course, complété d'exactement une course après.
 */
public interface SeasonStore {

    /** Toutes les courses enregistrées, par numéro croissant. */
    List<Race> loadRaces();

    /** Les résultats de toutes les courses, aplatis dans l'ordre des courses. */
    default List<ScoredResult> loadHistory() {
        return loadRaces().stream()
                .flatMap(race -> race.getResults().stream())
                .toList();
    }

    /** Numéro de la prochaine course : 1 si la saison est vide, sinon max + 1. */
    int nextRaceNumber();

    boolean contains(int raceNum);

    Race append(Race race);
}
