package com.tony.thunderAlley.service;

import com.tony.thunderAlley.config.LeagueConfigLoader;
import com.tony.thunderAlley.config.LeagueProperties;
import com.tony.thunderAlley.model.Car;
import com.tony.thunderAlley.model.FinishInput;
import com.tony.thunderAlley.model.GridEntry;
import com.tony.thunderAlley.model.LeagueConfig;
import com.tony.thunderAlley.model.Qualifier;
import com.tony.thunderAlley.model.Race;
import com.tony.thunderAlley.model.ScoredRace;
import com.tony.thunderAlley.model.ScoredResult;
import com.tony.thunderAlley.model.TeamRaceResult;
import com.tony.thunderAlley.model.dto.GridResponse;
import com.tony.thunderAlley.model.dto.RaceSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Déroulé d'une course : qualification et grille avant le départ, puis notation, enregistrement
 * et mise à jour des classements une fois l'arrivée saisie.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RaceService {

    public static final int MIN_TEAMS = 2;
    public static final int MAX_TEAMS = 7;

    private final SeasonStore seasonStore;
    private final LeagueConfigLoader configLoader;
    private final LeagueProperties properties;
    private final QualifyingEngine qualifyingEngine;
    private final GridBuilder gridBuilder;
    private final ResultScorer resultScorer;
    private final RaceArchiveService archiveService;
    private final StandingsService standingsService;

    public GridResponse prepareGrid(List<String> teams) {
        LeagueConfig config = configLoader.load();
        checkTeams(teams, config);

        List<ScoredResult> history = seasonStore.loadHistory();
        List<Qualifier> qualifiers = qualifyingEngine.qualify(history);
        List<GridEntry> grid = gridBuilder.build(teams, config.getPolePosition(), qualifiers,
                config.roster(), properties.getGridFillPolicy());

        log.info("🚦 Grille prête pour {} : {} voitures ({} résultats d'historique)", teams, grid.size(), history.size());
        return new GridResponse(GridBuilder.carsPerTeam(teams.size()), qualifiers.isEmpty(), qualifiers, grid);
    }

    /**
     * Note la course saisie, l'ajoute à la saison puis rafraîchit archive et classements.
     *
     * @throws NoSuchElementException   écurie, circuit ou voiture inconnus
     * @throws IllegalArgumentException nombre d'écuries invalide, grille incohérente avec le roster,
     *                                  arrivées manquantes ou en double
     */
    public Race recordRace(RaceSubmission submission) {
        LeagueConfig config = configLoader.load();
        checkTeams(submission.getTeams(), config);
        if (!config.getTracks().containsKey(submission.getTrackId())) {
            throw new NoSuchElementException("Circuit inconnu : " + submission.getTrackId());
        }
        if (submission.getGrid() == null || submission.getGrid().isEmpty()) {
            throw new IllegalArgumentException("Grille vide : pas de course");
        }
        if (submission.getFinishes() == null || submission.getFinishes().isEmpty()) {
            throw new IllegalArgumentException("Ordre d'arrivée vide");
        }
        checkGrid(submission.getGrid(), submission.getTeams(), config);
        checkFinishes(submission.getGrid(), submission.getFinishes());

        ScoredRace scored = resultScorer.score(submission.getGrid(), submission.getFinishes(), config.getPointsStructure());
        List<TeamRaceResult> teamResults = resultScorer.teamResults(scored);

        LocalDate date = submission.getDate() != null ? submission.getDate() : LocalDate.now();
        Race race = new Race(date, seasonStore.nextRaceNumber(), submission.getTrackId(), scored.results(), teamResults);
        Race saved = seasonStore.append(race);

        if (properties.isArchiveEnabled()) {
            // Course déjà enregistrée : un échec d'archive ou d'export est journalisé, pas remonté
            try {
                archiveService.write(saved);
                standingsService.recalculateAndExport();
            } catch (UncheckedIOException e) {
                log.error("❌ Course n°{} enregistrée mais archive/exports non mis à jour : {}",
                        saved.getRaceNum(), e.getMessage(), e);
            }
        }
        log.info("✅ Course n°{} sur {} : vainqueur écurie {}", saved.getRaceNum(), saved.getTrackId(),
                teamResults.isEmpty() ? "-" : teamResults.get(0).getTeam());
        return saved;
    }

    public List<Race> getRaces() {
        return seasonStore.loadRaces();
    }

    private void checkTeams(List<String> teams, LeagueConfig config) {
        if (teams == null || teams.size() < MIN_TEAMS || teams.size() > MAX_TEAMS) {
            throw new IllegalArgumentException("Une course se joue entre " + MIN_TEAMS + " et " + MAX_TEAMS + " écuries");
        }
        if (new HashSet<>(teams).size() != teams.size()) {
            throw new IllegalArgumentException("Écurie engagée deux fois : " + teams);
        }
        for (String team : teams) {
            if (!config.getTeamOwners().containsKey(team)) {
                throw new NoSuchElementException("Écurie inconnue : " + team);
            }
        }
    }

    // Grille renvoyée par le client : voitures du roster, écuries engagées, positions 1..N sans trou
    private void checkGrid(List<GridEntry> grid, List<String> teams, LeagueConfig config) {
        Map<Integer, Car> roster = config.roster().stream()
                .collect(Collectors.toMap(Car::carNumber, Function.identity()));
        Set<Integer> seenCars = new HashSet<>();
        Set<Integer> positions = new HashSet<>();
        for (GridEntry entry : grid) {
            if (!seenCars.add(entry.getCarNumber())) {
                throw new IllegalArgumentException("Voiture #" + entry.getCarNumber() + " placée deux fois sur la grille");
            }
            Car car = roster.get(entry.getCarNumber());
            if (car == null) {
                throw new IllegalArgumentException("Voiture #" + entry.getCarNumber() + " absente du roster");
            }
            if (!car.driver().equals(entry.getDriver()) || !car.team().equals(entry.getTeam())) {
                throw new IllegalArgumentException("Voiture #" + entry.getCarNumber() + " : pilote ou écurie différent du roster ("
                        + car.driver() + ", " + car.team() + ")");
            }
            if (!teams.contains(entry.getTeam())) {
                throw new IllegalArgumentException("Écurie " + entry.getTeam() + " non engagée dans cette course");
            }
            int position = entry.getStartingPosition();
            if (position < 1 || position > grid.size() || !positions.add(position)) {
                throw new IllegalArgumentException("Position de départ invalide ou en double : " + position
                        + " (attendu 1.." + grid.size() + ")");
            }
        }
    }

    // Une arrivée par voiture de la grille, sans doublon de voiture ni de position
    private void checkFinishes(List<GridEntry> grid, List<FinishInput> finishes) {
        Set<Integer> seenCars = new HashSet<>();
        Set<Integer> seenPositions = new HashSet<>();
        for (FinishInput finish : finishes) {
            if (!seenCars.add(finish.getCarNumber())) {
                throw new IllegalArgumentException("Voiture #" + finish.getCarNumber() + " saisie deux fois");
            }
            if (!finish.isDnq() && (finish.getFinish() < 1 || !seenPositions.add(finish.getFinish()))) {
                throw new IllegalArgumentException("Position d'arrivée invalide ou en double : " + finish.getFinish());
            }
            if (finish.getTurnsLed() < 0) {
                throw new IllegalArgumentException("Tours menés négatifs pour la voiture #" + finish.getCarNumber());
            }
        }
        Set<Integer> missing = grid.stream()
                .map(GridEntry::getCarNumber)
                .filter(car -> !seenCars.contains(car))
                .collect(Collectors.toCollection(TreeSet::new));
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Arrivée manquante pour les voitures " + missing + " (utiliser DNQ)");
        }
    }
}
