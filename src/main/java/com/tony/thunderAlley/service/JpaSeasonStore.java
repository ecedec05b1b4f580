package com.tony.thunderAlley.service;

import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.repository.RaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSeasonStore implements SeasonStore {

    private final RaceRepository raceRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Race> loadRaces() {
        return raceRepository.findAllByOrderByRaceNumAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public int nextRaceNumber() {
        return raceRepository.findMaxRaceNum().map(max -> max + 1).orElse(1);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean contains(int raceNum) {
        return raceRepository.existsByRaceNum(raceNum);
    }

    @Override
    @Transactional
    public Race append(Race race) {
        if (race.getRaceNum() == null) {
            race.setRaceNum(nextRaceNumber());
        } else if (raceRepository.existsByRaceNum(race.getRaceNum())) {
            throw new IllegalArgumentException("La course n°" + race.getRaceNum() + " est déjà enregistrée");
        }
        Race saved = raceRepository.save(race);
        log.info("💾 Course n°{} enregistrée ({} résultats)", saved.getRaceNum(), saved.getResults().size());
        return saved;
    }
}
