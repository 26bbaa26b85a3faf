package hk.edu.hulab.portal.backend.controller;

import hk.edu.hulab.portal.backend.config.PortalPrincipal;
import hk.edu.hulab.portal.backend.dto.LoginRequest;
import hk.edu.hulab.portal.backend.model.UserProfile;
import hk.edu.hulab.portal.backend.service.UserProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/profile")
@Tag(name = "Profile", description = "Current user's profile")
public class ProfileController {

    private final UserProfileService userProfileService;

    public ProfileController(UserProfileService userProfileService) {
        this.userProfileService = userProfileService;
    }

    @GetMapping
    @Operation(summary = "Get profile", description = "Get the authenticated user's profile")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile found"),
            @ApiResponse(responseCode = "404", description = "No profile recorded yet")
    })
    public ResponseEntity<UserProfile> getProfile(@AuthenticationPrincipal PortalPrincipal principal) {
        return ResponseEntity.ok(userProfileService.getProfile(principal.email()));
    }

    @PutMapping
    @Operation(summary = "Update profile", description = "Merge fields into the profile; id, email, provider and createdAt are kept")
    public ResponseEntity<UserProfile> updateProfile(
            @AuthenticationPrincipal PortalPrincipal principal,
            @RequestBody Map<String, Object> updates) {

        return ResponseEntity.ok(userProfileService.updateProfile(principal.email(), updates));
    }

    @PostMapping("/login")
    @Operation(summary = "Record login", description = "Create the profile on first sign-in or count another login")
    public ResponseEntity<UserProfile> recordLogin(
            @AuthenticationPrincipal PortalPrincipal principal,
            @RequestBody(required = false) LoginRequest request) {

        return ResponseEntity.ok(userProfileService.recordLogin(principal.email(), request));
    }

    @GetMapping("/permissions")
    @Operation(summary = "Check permission", description = "Whether the user's role grants a permission")
    public ResponseEntity<Map<String, Object>> hasPermission(
            @AuthenticationPrincipal PortalPrincipal principal,
            @RequestParam String permission) {

        return ResponseEntity.ok(Map.of(
                "permission", permission,
                "granted", userProfileService.hasPermission(principal.email(), permission)));
    }
}
