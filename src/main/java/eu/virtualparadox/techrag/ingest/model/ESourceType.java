package eu.virtualparadox.techrag.ingest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of input a chunk was extracted from.
 */
public enum ESourceType {
    PDF,
    IMAGE,
    WEB;

    /**
     * Lowercase name used in the index and in API payloads.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ESourceType fromWireName(final String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
