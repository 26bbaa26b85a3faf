package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Agent identity as it appears on statements. The e-mail behind {@code mbox} is the agent key
 * used for every profile and state blob.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Actor {

    private static final String MAILTO = "mailto:";

    private String mbox;

    private String name;

    public static Actor ofEmail(String email) {
        return ofEmail(email, null);
    }

    public static Actor ofEmail(String email, String name) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Actor must have an email");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        String displayName = name != null ? name : normalized.split("@")[0];
        return new Actor(MAILTO + normalized, displayName);
    }

    public String email() {
        if (mbox == null) {
            return null;
        }
        return mbox.startsWith(MAILTO) ? mbox.substring(MAILTO.length()) : mbox;
    }
}
