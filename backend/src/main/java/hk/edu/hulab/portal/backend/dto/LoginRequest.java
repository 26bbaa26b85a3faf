package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity attributes handed over by the upstream authentication layer after a successful sign-in.
 * The e-mail itself comes from the authenticated caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Identity attributes recorded on login")
public class LoginRequest {

    @Schema(description = "Identity provider subject id", example = "109876543210")
    private String id;

    @Schema(description = "Display name", example = "Alice Chan")
    private String name;

    private String firstName;
    private String lastName;

    @Schema(description = "Avatar URL")
    private String avatar;

    @Schema(description = "Identity provider", example = "google")
    private String provider;
}
