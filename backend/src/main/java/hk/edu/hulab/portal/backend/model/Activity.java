package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Statement object: an addressable entity such as {@code http://hulab.edu.hk/project/{id}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Activity {

    private String id;

    private ActivityDefinition definition;

    public static Activity of(String id) {
        return new Activity(id, null);
    }

    public static Activity of(String id, String type, String name) {
        return new Activity(id, ActivityDefinition.builder()
                .type(type)
                .name(Map.of(Vocabulary.LANGUAGE, name))
                .build());
    }

    public String displayName() {
        if (definition != null && definition.getName() != null
                && definition.getName().containsKey(Vocabulary.LANGUAGE)) {
            return definition.getName().get(Vocabulary.LANGUAGE);
        }
        return id;
    }

    public String type() {
        return definition != null ? definition.getType() : null;
    }

    /**
     * Last path segment of the IRI, i.e. the entity id for addresses built by {@link Vocabulary#address}.
     */
    public String tail() {
        return id == null ? null : id.substring(id.lastIndexOf('/') + 1);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ActivityDefinition {
        private String type;
        private Map<String, String> name;
        private Map<String, String> description;
    }
}
