package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import hk.edu.hulab.portal.backend.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * RIDE-I research framework phases, in order.
 */
public enum ProjectPhase {
    RESOURCE,
    INFORMATION,
    DECISIONS,
    EXPERIENCE,
    IMPLEMENTATION;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProjectPhase fromKey(String key) {
        for (ProjectPhase phase : values()) {
            if (phase.key().equalsIgnoreCase(key == null ? "" : key.trim())) {
                return phase;
            }
        }
        throw new ValidationException("Phase must be one of: " + Arrays.stream(values())
                .map(ProjectPhase::key)
                .collect(Collectors.joining(", ")));
    }
}
