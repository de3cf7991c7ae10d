package com.portico.backend.modules.auth.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UserRoleTest {

    @Test
    void higherRolesSatisfyLowerRequirements() {
        assertThat(UserRole.SUPER_ADMIN.hasPermission(UserRole.ADMIN)).isTrue();
        assertThat(UserRole.SUPER_ADMIN.hasPermission(UserRole.USER)).isTrue();
        assertThat(UserRole.ADMIN.hasPermission(UserRole.ADMIN)).isTrue();
        assertThat(UserRole.ADMIN.hasPermission(UserRole.SUPER_ADMIN)).isFalse();
        assertThat(UserRole.USER.hasPermission(UserRole.ADMIN)).isFalse();
        assertThat(UserRole.USER.hasPermission(null)).isFalse();
    }

    @Test
    void managementMatrix() {
        assertThat(UserRole.SUPER_ADMIN.canManageRole(UserRole.SUPER_ADMIN)).isTrue();
        assertThat(UserRole.SUPER_ADMIN.canManageRole(UserRole.ADMIN)).isTrue();
        assertThat(UserRole.SUPER_ADMIN.canManageRole(UserRole.USER)).isTrue();

        assertThat(UserRole.ADMIN.canManageRole(UserRole.USER)).isTrue();
        assertThat(UserRole.ADMIN.canManageRole(UserRole.ADMIN)).isFalse();
        assertThat(UserRole.ADMIN.canManageRole(UserRole.SUPER_ADMIN)).isFalse();

        assertThat(UserRole.USER.canManageRole(UserRole.USER)).isFalse();
    }

    @Test
    void authoritiesIncludeInheritedRoles() {
        assertThat(UserRole.USER.grantedAuthorities()).containsExactly("ROLE_USER");
        assertThat(UserRole.SUPER_ADMIN.grantedAuthorities())
                .containsExactly("ROLE_USER", "ROLE_ADMIN", "ROLE_SUPER_ADMIN");
    }

    @Test
    void parsesStoredCodes() {
        assertThat(UserRole.fromCode("super_admin")).isEqualTo(UserRole.SUPER_ADMIN);
        assertThat(UserRole.fromCode(" Admin ")).isEqualTo(UserRole.ADMIN);
        assertThrows(IllegalArgumentException.class, () -> UserRole.fromCode("owner"));
        assertThat(UserStatus.fromCode("banned")).isEqualTo(UserStatus.BANNED);
    }
}
