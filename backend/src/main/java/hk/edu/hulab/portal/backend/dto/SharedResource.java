package hk.edu.hulab.portal.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import hk.edu.hulab.portal.backend.model.ShareRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A share as seen by one of its parties. {@code shareRecord} is null when the share document could not be
 * read and only the statement summary is available.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Shared resource")
public class SharedResource {

    private String shareId;
    private String resourceType;
    private String resourceId;
    private String resourceName;
    private String sharedBy;
    private List<String> recipients;
    private List<String> permissions;
    private String message;
    private Instant sharedAt;
    private ShareRecord shareRecord;
}
