package com.tony.thunderAlley.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.tony.thunderAlley.model.json.DnqAwareDeserializer;
import com.tony.thunderAlley.model.json.DnqAwareSerializer;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Arrivée saisie à la main pour une voiture de la grille. {@code finish == null} signifie DNQ.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinishInput {
    private int carNumber;

    @JsonSerialize(nullsUsing = DnqAwareSerializer.class)
    @JsonDeserialize(using = DnqAwareDeserializer.class)
    private Integer finish;

    private int turnsLed;

    public static FinishInput finished(int carNumber, int finish, int turnsLed) {
        return new FinishInput(carNumber, finish, turnsLed);
    }

    public static FinishInput dnq(int carNumber) {
        return new FinishInput(carNumber, null, 0);
    }

    @JsonIgnore
    public boolean isDnq() {
        return finish == null;
    }
}
