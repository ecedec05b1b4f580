package com.tony.thunderAlley.repository;

import com.tony.thunderAlley.model.Race;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface RaceRepository extends JpaRepository<Race, Long> {

    // Historique complet de la saison, dans l'ordre des courses
    List<Race> findAllByOrderByRaceNumAsc();

    @Query("SELECT MAX(r.raceNum) FROM Race r")
    Optional<Integer> findMaxRaceNum();

    boolean existsByRaceNum(Integer raceNum);
}
