package com.tony.thunderAlley.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Une course enregistrée : c'est l'unité que le store de saison ajoute (une par course)
 * et relit en bloc avant la course suivante.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"race_num"})
})
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"date", "raceNum", "trackId", "results", "teamResults"})
public class Race {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @Column(name = "race_date", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    @Column(name = "race_num", nullable = false)
    private Integer raceNum;

    @Column(nullable = false)
    private String trackId;

    // @OrderColumn : listes indexées, sinon Hibernate refuse deux "bags" chargés en EAGER
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "race_results", joinColumns = @JoinColumn(name = "race_id"))
    @OrderColumn(name = "row_index")
    private List<ScoredResult> results = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "race_team_results", joinColumns = @JoinColumn(name = "race_id"))
    @OrderColumn(name = "row_index")
    private List<TeamRaceResult> teamResults = new ArrayList<>();

    public Race(LocalDate date, Integer raceNum, String trackId,
                List<ScoredResult> results, List<TeamRaceResult> teamResults) {
        this.date = date;
        this.raceNum = raceNum;
        this.trackId = trackId;
        this.results = new ArrayList<>(results);
        this.teamResults = new ArrayList<>(teamResults);
    }

    // Nom du fichier d'archive brute : race_{date}_r{num}.json
    public String archiveFileName() {
        return "race_" + date + "_r" + raceNum + ".json";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Race)) return false;
        return id != null && id.equals(((Race) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
