package com.tony.thunderAlley.model.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Écrit une position absente (null) sous la forme littérale "DNQ".
 * S'utilise via {@code @JsonSerialize(nullsUsing = DnqAwareSerializer.class)}.
 */
public class DnqAwareSerializer extends StdSerializer<Integer> {

    public static final String DNQ = "DNQ";

    public DnqAwareSerializer() {
        super(Integer.class);
    }

    @Override
    public void serialize(Integer value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value == null) {
            gen.writeString(DNQ);
        } else {
            gen.writeNumber(value);
        }
    }
}
