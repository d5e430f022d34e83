package com.basketgov.api;

import java.util.Set;

/**
 * Identity of the authenticated caller, as forwarded by the upstream auth
 * layer. Stored as a request attribute by {@link CallerHeaderFilter}.
 */
public record CallerContext(String workspaceId, String userId, String role) {

    public static final String ATTRIBUTE = "caller";

    private static final Set<String> ADMIN_ROLES = Set.of("admin", "owner");

    public boolean isAdmin() {
        return role != null && ADMIN_ROLES.contains(role.trim().toLowerCase());
    }
}
