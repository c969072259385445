package com.hypecycle.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of the blob columns of the {@code analyses} table.
 * Absent values are stored as SQL NULL and decode to {@code null} or an empty collection.
 */
public class CacheEntryCodec {

    private static final TypeReference<Map<String, PhaseOpinion>> OPINIONS = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public CacheEntryCodec() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String writeMetrics(SourceMetrics metrics) {
        return metrics == null ? null : write(metrics);
    }

    public SourceMetrics readMetrics(String json) {
        return json == null ? null : read(json, SourceMetrics.class);
    }

    /** Opinions keyed by source key, in canonical source order. */
    public String writeOpinions(Map<SourceName, PhaseOpinion> opinions) {
        if (opinions == null || opinions.isEmpty()) {
            return null;
        }
        Map<String, PhaseOpinion> byKey = new LinkedHashMap<>();
        for (SourceName source : SourceName.values()) {
            if (opinions.containsKey(source)) {
                byKey.put(source.key(), opinions.get(source));
            }
        }
        return write(byKey);
    }

    public Map<SourceName, PhaseOpinion> readOpinions(String json) {
        Map<SourceName, PhaseOpinion> opinions = new EnumMap<>(SourceName.class);
        if (json != null) {
            read(json, OPINIONS).forEach((key, opinion) -> opinions.put(SourceName.fromKey(key), opinion));
        }
        return opinions;
    }

    public String writeStrings(List<String> values) {
        return values == null || values.isEmpty() ? null : write(values);
    }

    public List<String> readStrings(String json) {
        return json == null ? List.of() : read(json, STRINGS);
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheStoreException("Could not encode " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CacheStoreException("Could not decode " + type.getSimpleName(), e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CacheStoreException("Could not decode " + type.getType().getTypeName(), e);
        }
    }
}
