package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import flowescrow.escrow.model.Role;

import java.util.Locale;

/**
 * Request DTO for role membership changes.
 * POST /api/v1/roles/grant, POST /api/v1/roles/revoke
 */
public record RoleRequest(
        @JsonProperty("role") String role,
        @JsonProperty("account") String account) {

    /**
     * @throws IllegalArgumentException if the role is missing or unknown
     */
    public Role parsedRole() {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role is required");
        }
        try {
            return Role.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown role: " + role);
        }
    }
}
