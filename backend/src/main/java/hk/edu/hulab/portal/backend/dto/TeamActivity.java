package hk.edu.hulab.portal.backend.dto;

import java.time.Instant;

public record TeamActivity(String actor, String action, String object, Instant timestamp) {
}
