package com.ascentful.accessservice.infrastructure.web;

import com.ascentful.access.IdentitySnapshot;
import com.ascentful.access.IdentityStatus;
import com.ascentful.access.Plan;
import com.ascentful.access.Role;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads the caller from the trusted headers the identity gateway sets on every request.
 *
 * <p>{@code X-Identity-Status} may be {@code loading}, {@code absent} or {@code ready}. When it
 * is missing, the caller is ready if {@code X-Subject-Id} is present and signed out otherwise.
 */
public final class IdentityHeaders {

    public static final String STATUS = "X-Identity-Status";
    public static final String SUBJECT_ID = "X-Subject-Id";
    public static final String SESSION_ID = "X-Session-Id";
    public static final String ROLE = "X-User-Role";
    public static final String ORGANIZATION_ID = "X-Organization-Id";
    public static final String ONBOARDING_COMPLETED = "X-Onboarding-Completed";
    public static final String ACCOUNT_CREATED_AT = "X-Account-Created-At";
    public static final String CREATED_BY_ADMIN = "X-Created-By-Admin";
    public static final String SUBSCRIPTION_PLAN = "X-Subscription-Plan";

    private IdentityHeaders() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException if a header is present but malformed, or a ready caller
     *     has no role
     */
    public static RequestIdentity parse(HttpServletRequest request) {
        String subjectId = trimmed(request.getHeader(SUBJECT_ID));
        IdentityStatus status = status(request.getHeader(STATUS), subjectId);
        if (status != IdentityStatus.READY) {
            return new RequestIdentity(
                    status == IdentityStatus.LOADING ? IdentitySnapshot.loading() : IdentitySnapshot.absent(),
                    null);
        }
        if (subjectId == null) {
            throw new IllegalArgumentException(SUBJECT_ID + " is required for a ready identity");
        }

        String roleCode = request.getHeader(ROLE);
        if (roleCode == null || roleCode.isBlank()) {
            throw new IllegalArgumentException(ROLE + " is required for a ready identity");
        }
        Role role = Role.fromString(roleCode)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + roleCode));

        var snapshot = new IdentitySnapshot(
                IdentityStatus.READY,
                subjectId,
                trimmed(request.getHeader(SESSION_ID)),
                role,
                trimmed(request.getHeader(ORGANIZATION_ID)),
                Boolean.parseBoolean(request.getHeader(ONBOARDING_COMPLETED)),
                instant(request.getHeader(ACCOUNT_CREATED_AT)),
                Boolean.parseBoolean(request.getHeader(CREATED_BY_ADMIN)));
        return new RequestIdentity(snapshot, plan(request.getHeader(SUBSCRIPTION_PLAN)));
    }

    private static IdentityStatus status(String header, String subjectId) {
        if (header == null || header.isBlank()) {
            return subjectId != null ? IdentityStatus.READY : IdentityStatus.ABSENT;
        }
        return switch (header.strip().toLowerCase(Locale.ROOT)) {
            case "loading" -> IdentityStatus.LOADING;
            case "absent" -> IdentityStatus.ABSENT;
            case "ready" -> IdentityStatus.READY;
            default -> throw new IllegalArgumentException("Unknown " + STATUS + ": " + header);
        };
    }

    private static Instant instant(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(header.strip());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(ACCOUNT_CREATED_AT + " must be an ISO-8601 instant", e);
        }
    }

    private static Plan plan(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        return Plan.fromString(header)
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan: " + header));
    }

    private static String trimmed(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
