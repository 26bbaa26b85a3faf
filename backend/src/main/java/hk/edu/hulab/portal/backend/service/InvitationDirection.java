package hk.edu.hulab.portal.backend.service;

import hk.edu.hulab.portal.backend.exception.ValidationException;

import java.util.Locale;

/**
 * Which side of an invitation the caller is asking about.
 */
public enum InvitationDirection {
    RECEIVED,
    SENT,
    ALL;

    public static InvitationDirection fromKey(String key) {
        if (key == null || key.isBlank()) {
            return RECEIVED;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invitation type must be one of received, sent or all");
        }
    }

    boolean includesReceived() {
        return this != SENT;
    }

    boolean includesSent() {
        return this != RECEIVED;
    }
}
