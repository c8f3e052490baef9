package com.motaz.telemetry.engine.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motaz.telemetry.engine.exception.StoreUnavailableException;
import com.motaz.telemetry.engine.model.BaselineTable;
import com.motaz.telemetry.engine.model.RunningStat;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of a {@link BaselineTable}:
 * <pre>
 * {"last_updated": "...", "channels": {"temperature": {"count": 40, "mean": 21.9, "M2": 88.1, "std": 1.48}}}
 * </pre>
 * {@code std} is written for readers and ignored on the way back in. The store version is not part of
 * the document.
 */
public class BaselineJsonCodec {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public BaselineJsonCodec() {
        this(new ObjectMapper());
    }

    public BaselineJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] toJson(BaselineTable table) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toDocumentRecord(table));
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Could not serialize baseline", e);
        }
    }

    public BaselineTable fromJson(byte[] json) {
        try {
            return fromDocumentRecord(objectMapper.readValue(json, BaselineDocument.class));
        } catch (IOException e) {
            throw new StoreUnavailableException("Stored baseline is not readable", e);
        }
    }

    public Map<String, Object> toDocument(BaselineTable table) {
        return objectMapper.convertValue(toDocumentRecord(table), DOCUMENT_TYPE);
    }

    public BaselineTable fromDocument(Map<String, Object> document) {
        try {
            return fromDocumentRecord(objectMapper.convertValue(document, BaselineDocument.class));
        } catch (IllegalArgumentException e) {
            throw new StoreUnavailableException("Stored baseline is not readable", e);
        }
    }

    private BaselineDocument toDocumentRecord(BaselineTable table) {
        Map<String, ChannelDocument> channels = new LinkedHashMap<>();
        table.getChannels().forEach((name, stat) ->
                channels.put(name, new ChannelDocument(stat.getCount(), stat.getMean(), stat.getM2(), stat.std())));
        String lastUpdated = table.getLastUpdated() == null ? null : table.getLastUpdated().toString();
        return new BaselineDocument(lastUpdated, channels);
    }

    private BaselineTable fromDocumentRecord(BaselineDocument document) {
        BaselineTable table = BaselineTable.empty();
        try {
            if (document.channels() != null) {
                document.channels().forEach((name, channel) ->
                        table.put(name, RunningStat.restore(channel.count(), channel.mean(), channel.m2())));
            }
            if (document.lastUpdated() != null) {
                table.setLastUpdated(Instant.parse(document.lastUpdated()));
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new StoreUnavailableException("Stored baseline violates its invariants: " + e.getMessage(), e);
        }
        return table;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BaselineDocument(@JsonProperty("last_updated") String lastUpdated,
                            @JsonProperty("channels") Map<String, ChannelDocument> channels) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChannelDocument(@JsonProperty("count") long count,
                           @JsonProperty("mean") double mean,
                           @JsonProperty("M2") double m2,
                           @JsonProperty("std") double std) {
    }
}
