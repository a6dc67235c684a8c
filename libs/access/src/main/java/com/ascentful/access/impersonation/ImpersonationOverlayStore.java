package com.ascentful.access.impersonation;

import com.ascentful.access.IdentitySnapshot;
import com.ascentful.access.Role;
import com.ascentful.access.RoleChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Session-scoped, single-slot store of impersonation overlays.
 * <p>
 * Each administrator session owns at most one slot, keyed by
 * {@link IdentitySnapshot#sessionKey()}. Start and stop are atomic per slot: a start
 * commits only into an empty slot, a stop empties it. Overlays are immutable, so a reader
 * sees either the previous or the next committed overlay and never a partial one. One
 * session's overlay is never visible through another session's key.
 * <p>
 * Every authorization check runs against the caller's real {@link IdentitySnapshot}, never
 * against an overlay. An administrator impersonating a student is still an administrator
 * to this store, and a student can never obtain an overlay at all.
 */
public class ImpersonationOverlayStore {

    private static final Logger log = LoggerFactory.getLogger(ImpersonationOverlayStore.class);

    private final ConcurrentMap<String, ImpersonationOverlay> slots = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ImpersonationAuditLogger audit;

    public ImpersonationOverlayStore() {
        this(Clock.systemUTC(), new ImpersonationAuditLogger());
    }

    public ImpersonationOverlayStore(Clock clock, ImpersonationAuditLogger audit) {
        this.clock = clock;
        this.audit = audit;
    }

    /**
     * Starts impersonating {@code target} for the administrator's session.
     *
     * @param actingAdmin real, non-overlaid snapshot of the caller
     * @param target      identity to adopt
     * @return the committed overlay, or {@code UNAUTHORIZED} / {@code INVALID_TARGET} /
     *         {@code ALREADY_ACTIVE}; a rejection leaves the slot untouched
     */
    public ImpersonationResult start(IdentitySnapshot actingAdmin, ImpersonationTarget target) {
        if (!RoleChecker.canImpersonate(actingAdmin)) {
            String subject = actingAdmin == null ? null : actingAdmin.subjectId();
            log.warn("Rejected impersonation by non-administrator subject={} role={}",
                    subject, actingAdmin == null ? null : actingAdmin.role());
            return reject(subject, target, ImpersonationError.UNAUTHORIZED,
                    "Only admin or super_admin may impersonate");
        }

        Optional<String> invalid = validateTarget(target);
        if (invalid.isPresent()) {
            log.warn("Rejected impersonation target for admin={}: {}", actingAdmin.subjectId(), invalid.get());
            return reject(actingAdmin.subjectId(), target, ImpersonationError.INVALID_TARGET, invalid.get());
        }

        ImpersonationOverlay candidate = ImpersonationOverlay.start(actingAdmin.subjectId(), target, clock.instant());
        ImpersonationOverlay existing = slots.putIfAbsent(actingAdmin.sessionKey(), candidate);
        if (existing != null) {
            log.warn("Rejected nested impersonation for admin={}: already impersonating {}",
                    actingAdmin.subjectId(), existing.impersonatedRole().value());
            return reject(actingAdmin.subjectId(), target, ImpersonationError.ALREADY_ACTIVE,
                    "An impersonation is already active for this session; stop it first");
        }

        log.info("Impersonation started admin={} role={} organization={} plan={}",
                candidate.actingAdminId(), candidate.impersonatedRole().value(),
                candidate.impersonatedOrganizationId(), candidate.impersonatedPlan());
        audit.record(ImpersonationAuditEvent.committed(ImpersonationAuditEvent.Event.START, candidate, clock.instant()));
        return ImpersonationResult.ok(candidate);
    }

    /**
     * Stops the session's impersonation. Idempotent: stopping an empty slot is a no-op.
     *
     * @param actingAdmin real snapshot of the caller
     */
    public void stop(IdentitySnapshot actingAdmin) {
        if (actingAdmin == null || !actingAdmin.isReady()) {
            return;
        }
        ImpersonationOverlay removed = slots.remove(actingAdmin.sessionKey());
        if (removed != null) {
            log.info("Impersonation stopped admin={} role={}", removed.actingAdminId(),
                    removed.impersonatedRole().value());
            audit.record(ImpersonationAuditEvent.committed(ImpersonationAuditEvent.Event.STOP, removed, clock.instant()));
        }
    }

    /**
     * Returns the session's active overlay.
     * <p>
     * Empty unless the caller is ready and still administrative. An overlay whose owner lost
     * the admin role mid-session is discarded, so a later re-promotion starts clean.
     *
     * @param actingAdmin real snapshot of the caller
     */
    public Optional<ImpersonationOverlay> current(IdentitySnapshot actingAdmin) {
        if (actingAdmin == null || !actingAdmin.isReady()) {
            return Optional.empty();
        }
        if (!RoleChecker.canImpersonate(actingAdmin)) {
            discardForDemotedOwner(actingAdmin);
            return Optional.empty();
        }
        return Optional.ofNullable(slots.get(actingAdmin.sessionKey()));
    }

    private void discardForDemotedOwner(IdentitySnapshot demoted) {
        String key = demoted.sessionKey();
        ImpersonationOverlay stale = slots.get(key);
        if (stale == null || !slots.remove(key, stale)) {
            return;
        }
        log.warn("Owner no longer administrative, impersonation discarded admin={} role={}",
                stale.actingAdminId(), demoted.role());
        audit.record(ImpersonationAuditEvent.committed(
                ImpersonationAuditEvent.Event.SESSION_END, stale, clock.instant()));
    }

    /**
     * Discards the overlay of a session that ended (sign-out, expiry).
     *
     * @param sessionKey key of the ended session
     * @return true if an overlay was discarded
     */
    public boolean endSession(String sessionKey) {
        if (sessionKey == null) {
            return false;
        }
        ImpersonationOverlay removed = slots.remove(sessionKey);
        if (removed == null) {
            return false;
        }
        log.info("Session ended, impersonation discarded admin={}", removed.actingAdminId());
        audit.record(ImpersonationAuditEvent.committed(
                ImpersonationAuditEvent.Event.SESSION_END, removed, clock.instant()));
        return true;
    }

    /** Number of sessions currently impersonating. */
    public int activeCount() {
        return slots.size();
    }

    private static Optional<String> validateTarget(ImpersonationTarget target) {
        if (target == null || target.role() == null) {
            return Optional.of("target role is required");
        }
        Role role = target.role();
        if (!role.isImpersonatable()) {
            return Optional.of("role %s cannot be impersonated".formatted(role.value()));
        }
        boolean hasOrganization = target.organizationId() != null && !target.organizationId().isBlank();
        if (role.requiresOrganization() && !hasOrganization) {
            return Optional.of("role %s requires an organizationId".formatted(role.value()));
        }
        return Optional.empty();
    }

    private ImpersonationResult reject(
            String actingAdminId, ImpersonationTarget target, ImpersonationError error, String message) {
        audit.record(ImpersonationAuditEvent.rejected(actingAdminId, target, error, clock.instant()));
        return ImpersonationResult.fail(error, message);
    }
}
