package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Bookkeeping shared by every document kept in an activity-state blob.
 * The mapper owns {@code version}, {@code updatedAt} and the deletion fields.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class StateDocument {

    private String id;

    private Integer version;

    private DocumentStatus status;

    private String createdBy;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant deletedAt;

    private String deletedBy;

    @JsonIgnore
    public boolean isDeleted() {
        return status == DocumentStatus.DELETED;
    }

    /**
     * Human readable name used on statements about this document, null for the generic "{type} {id}".
     */
    @JsonIgnore
    public String displayName() {
        return null;
    }
}
