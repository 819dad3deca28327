package org.gopti.planner.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

public class CodedSerializer extends JsonSerializer<Coded> {

    @Override
    public void serialize(Coded value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(value.code());
    }
}
