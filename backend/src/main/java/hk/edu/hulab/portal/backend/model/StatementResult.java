package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatementResult {

    private Boolean success;

    private Boolean completion;

    private String response;

    private Score score;

    /**
     * ISO-8601 duration, e.g. {@code PT90S}.
     */
    private String duration;

    private Extensions extensions;

    public Double scaledScore() {
        return score != null ? score.getScaled() : null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Score {
        private Double scaled;
    }
}
