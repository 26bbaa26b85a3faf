package hk.edu.hulab.portal.backend.analytics;

import java.time.Instant;

public record PhaseTransition(String from, String to, String by, Instant at) {
}
