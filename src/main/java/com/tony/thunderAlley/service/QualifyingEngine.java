package com.tony.thunderAlley.service;

import com.tony.thunderAlley.model.Qualifier;
import com.tony.thunderAlley.model.ScoredResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

@Service
@Slf4j
public class QualifyingEngine {

    public static final int MAX_QUALIFIERS_PER_TEAM = 4;

    // Plancher du poids : une voiture sans point garde une (petite) chance
    private static final double MIN_WEIGHT = 1e-6;

    public List<Qualifier> qualify(List<ScoredResult> history) {
        return qualify(history, new Random());
    }

    /**
     * Tirage pondéré de l'ordre de qualification au sein de chaque écurie.
     * Chaque voiture tire u dans [0,1) et reçoit la clé u^(1/poids), où le poids est sa part
     * des points de qualification cumulés de son écurie (1/taille si elle n'en a aucun). Les clés sont classées par ordre
     * décroissant (rang dense, 1 = meilleur) et seuls les 4 premiers rangs sont conservés.
     *
     * @param history tous les résultats de la saison jusqu'ici (éventuellement vide)
     * @param random  source d'aléa, injectée pour rendre les tests déterministes
     * @return les qualifiés, triés par écurie puis par rang ; vide sans historique
     */
    public List<Qualifier> qualify(List<ScoredResult> history, Random random) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }

        // 1. Score de qualification cumulé par voiture (ordre de première apparition)
        Map<CarKey, Integer> scores = new LinkedHashMap<>();
        for (ScoredResult r : history) {
            scores.merge(new CarKey(r.getCarNumber(), r.getDriver(), r.getTeam()), r.getQualifyingPoints(), Integer::sum);
        }

        // 2. Regroupement par écurie (ordre alphabétique, comme la sortie)
        Map<String, List<CarKey>> byTeam = new TreeMap<>(Comparator.nullsFirst(Comparator.naturalOrder()));
        scores.keySet().forEach(car -> byTeam.computeIfAbsent(car.team(), t -> new ArrayList<>()).add(car));

        List<Qualifier> qualifiers = new ArrayList<>();
        for (Map.Entry<String, List<CarKey>> entry : byTeam.entrySet()) {
            List<CarKey> cars = entry.getValue();
            int teamPoints = cars.stream().mapToInt(scores::get).sum();

            // 3. Clé d'échantillonnage pondérée
            List<Draw> draws = new ArrayList<>(cars.size());
            for (CarKey car : cars) {
                double weight = weight(scores.get(car), teamPoints, cars.size());
                double u = random.nextDouble();
                draws.add(new Draw(car, Math.pow(u, 1.0 / weight)));
            }

            // 4. Rang dense par clé décroissante (tri stable)
            draws.sort(Comparator.comparingDouble(Draw::key).reversed());
            int rank = 0;
            double previousKey = Double.NaN;
            for (Draw draw : draws) {
                if (rank == 0 || Double.compare(draw.key(), previousKey) != 0) {
                    rank++;
                    previousKey = draw.key();
                }
                if (rank > MAX_QUALIFIERS_PER_TEAM) break;
                CarKey car = draw.car();
                qualifiers.add(new Qualifier(car.carNumber(), car.driver(), car.team(), rank));
            }
            log.debug("Qualification {} : {} voitures, {} points d'écurie", entry.getKey(), cars.size(), teamPoints);
        }
        return qualifiers;
    }

    /**
     * Part de la voiture dans les points de son écurie, bornée à [1e-6, 1].
     * Repli sur une part égale (1/taille) pour une voiture sans aucun point, ce qui couvre
     * le cas d'une écurie entière à zéro.
     */
    static double weight(int carScore, int teamPoints, int teamSize) {
        double w = carScore == 0 || teamPoints == 0 ? 1.0 / teamSize : (double) carScore / teamPoints;
        if (Double.isNaN(w)) return MIN_WEIGHT;
        return Math.min(1.0, Math.max(MIN_WEIGHT, w));
    }

    private record CarKey(int carNumber, String driver, String team) {}

    private record Draw(CarKey car, double key) {}
}
