package com.deda.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.InjectableValues;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of configuration layers. Files are pretty-printed JSON with
 * sorted keys and without null properties so diffs between saves stay small. Unknown properties are
 * ignored so older builds can read files written by newer ones.
 */
public final class ConfigCodec {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private static final DefaultPrettyPrinter PRINTER = new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("    ", "\n"))
            .withArrayIndenter(new DefaultIndenter("    ", "\n"));

    private ConfigCodec() {
    }

    /**
     * Parses a layer of the given type. {@code scopeKey} is injected because a record's identity
     * comes from where it was loaded, not from the file content.
     *
     * @throws JsonProcessingException when the JSON is malformed or has the wrong shape
     */
    public static <T extends LayerConfig> T fromJson(String json, Class<T> type, ScopeKey scopeKey)
            throws JsonProcessingException {
        return MAPPER.readerFor(type)
                .with(new InjectableValues.Std().addValue(ScopeKey.class, scopeKey))
                .readValue(json);
    }

    /**
     * Serializes a layer to JSON indented by four spaces.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(LayerConfig config) {
        try {
            return MAPPER.writer(PRINTER).writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Converts a setting value to the plain JSON form it has after a save and reload: maps, lists,
     * strings, booleans, {@code Integer}/{@code Long}/{@code BigInteger} and {@code Double}.
     *
     * @throws IllegalArgumentException when the value cannot be written as JSON
     */
    public static Object toJsonValue(Object value) {
        if (value == null) return null;
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(value), Object.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName()
                    + " cannot be stored as a setting", e);
        }
    }

    /** Shared mapper for modules that store structured values inside layer settings. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
