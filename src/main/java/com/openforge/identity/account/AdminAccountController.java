package com.openforge.identity.account;

import com.openforge.identity.common.ValidationException;
import com.openforge.identity.domain.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Base path: /api/admin/accounts (ROLE_ADMIN only, enforced in SecurityConfig)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/accounts")
public class AdminAccountController {

    private final AccountAdminService adminService;

    public record ActiveRequest(@NotNull Boolean active) {}

    public record RoleRequest(@NotBlank String role) {}

    @PutMapping("/{id}/active")
    public AccountView setActive(@PathVariable Long id, @Valid @RequestBody ActiveRequest req) {
        return AccountView.selfView(adminService.setActive(id, req.active()));
    }

    @PutMapping("/{id}/role")
    public AccountView setRole(@PathVariable Long id, @Valid @RequestBody RoleRequest req) {
        Role role;
        try {
            role = Role.fromWire(req.role());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ValidationException.INVALID_ROLE, "Role must be user or admin");
        }
        return AccountView.selfView(adminService.setRole(id, role));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        adminService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
