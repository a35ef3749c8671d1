package com.muji.db;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/** Общий ObjectMapper: документ на диске, HTTP-ответы и клиенты используют один формат. */
public final class Json {
    private static final ObjectMapper MAPPER = create();

    private Json() {}

    public static ObjectMapper mapper() { return MAPPER; }

    private static ObjectMapper create() {
        SimpleModule legacy = new SimpleModule("legacy-timestamps");
        legacy.addDeserializer(Instant.class, new LenientInstantDeserializer());

        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.registerModule(legacy);
        om.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    /**
     * Старые файлы писали время без зоны ("2024-05-01T12:30:00.123456"), новые пишут ISO-instant.
     * Время без зоны считается UTC.
     */
    static final class LenientInstantDeserializer extends StdDeserializer<Instant> {
        LenientInstantDeserializer() { super(Instant.class); }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) return Instant.ofEpochMilli(p.getLongValue());
            String raw = p.getValueAsString();
            if (raw == null || raw.isBlank()) return null;
            String s = raw.trim();
            try {
                return Instant.parse(s);
            } catch (DateTimeParseException notInstant) {
                try {
                    return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException e) {
                    return (Instant) ctxt.handleWeirdStringValue(Instant.class, s, "not an ISO timestamp");
                }
            }
        }
    }
}
