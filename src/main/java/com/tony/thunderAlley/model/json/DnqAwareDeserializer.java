package com.tony.thunderAlley.model.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Lit une position sous forme de nombre, de chaîne numérique ou de "DNQ" (qui devient null).
 */
public class DnqAwareDeserializer extends StdDeserializer<Integer> {

    public DnqAwareDeserializer() {
        super(Integer.class);
    }

    @Override
    public Integer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return p.getIntValue();
        }
        String text = p.getValueAsString();
        if (text == null || text.isBlank() || DnqAwareSerializer.DNQ.equalsIgnoreCase(text.trim())) {
            return null;
        }
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return (Integer) ctxt.handleWeirdStringValue(Integer.class, text, "position attendue : entier ou DNQ");
        }
    }
}
