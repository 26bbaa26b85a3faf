package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatementContext {

    private ContextActivities contextActivities;

    /**
     * Team members involved in a collaboration statement. Teams have no id of their own;
     * they are identified by the set of member mboxes.
     */
    private List<Actor> team;

    private String platform;

    private String language;

    private Extensions extensions;

    public static StatementContext withParent(Activity parent) {
        return StatementContext.builder()
                .contextActivities(ContextActivities.builder().parent(List.of(parent)).build())
                .build();
    }

    public static StatementContext withBackReference(Activity other, Extensions extensions) {
        return StatementContext.builder()
                .contextActivities(ContextActivities.builder().other(List.of(other)).build())
                .extensions(extensions)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContextActivities {
        @Builder.Default
        private List<Activity> parent = new ArrayList<>();
        @Builder.Default
        private List<Activity> grouping = new ArrayList<>();
        @Builder.Default
        private List<Activity> other = new ArrayList<>();
    }
}
