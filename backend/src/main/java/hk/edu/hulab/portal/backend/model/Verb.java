package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Verb {

    private String id;

    private Map<String, String> display;

    public static Verb of(String id, String display) {
        return new Verb(id, Map.of(Vocabulary.LANGUAGE, display));
    }

    public String displayText() {
        if (display != null && display.containsKey(Vocabulary.LANGUAGE)) {
            return display.get(Vocabulary.LANGUAGE);
        }
        if (id == null) {
            return "unknown";
        }
        return id.substring(id.lastIndexOf('/') + 1);
    }

    /**
     * Match on the IRI tail so that equivalent verbs from different vocabularies
     * (e.g. adlnet "completed" and a custom "completed") count the same.
     */
    public boolean idContains(String fragment) {
        return id != null && id.contains(fragment);
    }
}
