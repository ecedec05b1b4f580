package com.tony.thunderAlley.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.tony.thunderAlley.model.json.DnqAwareDeserializer;
import com.tony.thunderAlley.model.json.DnqAwareSerializer;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Résultat noté d'une voiture pour une course. Immuable une fois la course enregistrée :
 * il est relu plus tard comme historique de saison (qualification et classements).
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonPropertyOrder({"finish", "carNumber", "driver", "team", "startingPos", "turnsLed",
        "points", "playoffPoints", "relativeFinish", "qualifyingPoints"})
public class ScoredResult {

    // null = DNQ
    @JsonSerialize(nullsUsing = DnqAwareSerializer.class)
    @JsonDeserialize(using = DnqAwareDeserializer.class)
    private Integer finish;

    private int carNumber;
    private String driver;
    private String team;

    // null = DNQ
    @JsonSerialize(nullsUsing = DnqAwareSerializer.class)
    @JsonDeserialize(using = DnqAwareDeserializer.class)
    private Integer startingPos;

    private int turnsLed;
    private int points;
    private int playoffPoints;
    private int relativeFinish;
    private int qualifyingPoints;

    @JsonIgnore
    public boolean isDnq() {
        return finish == null;
    }

    /** Vrai si la voiture a terminé à la position {@code limit} ou mieux (jamais pour un DNQ). */
    public boolean finishedWithin(int limit) {
        return finish != null && finish <= limit;
    }

    public String finishLabel() {
        return finish != null ? finish.toString() : DnqAwareSerializer.DNQ;
    }

    public String startingPosLabel() {
        return startingPos != null ? startingPos.toString() : DnqAwareSerializer.DNQ;
    }
}
