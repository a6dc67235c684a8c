package com.ascentful.access;

import com.ascentful.access.testing.TestIdentityFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleChecker")
class RoleCheckerTest {

    @Nested
    @DisplayName("checks on the real identity")
    class RealIdentity {

        @Test
        @DisplayName("only ready administrators can impersonate")
        void canImpersonate() {
            assertThat(RoleChecker.canImpersonate(TestIdentityFactory.withRole(Role.ADMIN))).isTrue();
            assertThat(RoleChecker.canImpersonate(TestIdentityFactory.withRole(Role.SUPER_ADMIN))).isTrue();
            assertThat(RoleChecker.canImpersonate(TestIdentityFactory.withRole(Role.UNIVERSITY_ADMIN, "u")))
                    .isFalse();
            assertThat(RoleChecker.canImpersonate(IdentitySnapshot.loading())).isFalse();
            assertThat(RoleChecker.canImpersonate(null)).isFalse();
        }

        @Test
        @DisplayName("isSuperAdmin excludes plain admins")
        void superAdmin() {
            assertThat(RoleChecker.isSuperAdmin(TestIdentityFactory.superAdmin("root"))).isTrue();
            assertThat(RoleChecker.isSuperAdmin(TestIdentityFactory.admin("ops"))).isFalse();
        }
    }
}
