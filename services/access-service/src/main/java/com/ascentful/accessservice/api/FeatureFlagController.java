package com.ascentful.accessservice.api;

import com.ascentful.access.IdentityProvider;
import com.ascentful.access.IdentitySnapshot;
import com.ascentful.access.RoleChecker;
import com.ascentful.access.flags.FeatureFlagEvaluator;
import com.ascentful.access.flags.InMemoryFeatureFlagSource;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reads and changes feature flags.
 *
 * <p>Changes require a real super admin. The check reads the caller's real identity, so an
 * administrator impersonating someone keeps this right and no overlay can grant it.
 */
@RestController
@RequestMapping("/api/v1/flags")
public class FeatureFlagController {

    private static final Logger log = LoggerFactory.getLogger(FeatureFlagController.class);

    private final InMemoryFeatureFlagSource source;
    private final FeatureFlagEvaluator evaluator;
    private final IdentityProvider identityProvider;

    public FeatureFlagController(
            InMemoryFeatureFlagSource source, FeatureFlagEvaluator evaluator, IdentityProvider identityProvider) {
        this.source = source;
        this.evaluator = evaluator;
        this.identityProvider = identityProvider;
    }

    @GetMapping("/{flag}")
    public FlagStateResponse get(@PathVariable String flag, @RequestParam(required = false) String tenantId) {
        return new FlagStateResponse(flag, tenantId, evaluator.evaluate(flag, tenantId));
    }

    @PutMapping("/{flag}")
    public FlagStateResponse setDefault(@PathVariable String flag, @Valid @RequestBody FlagUpdateRequest request) {
        IdentitySnapshot caller = requireSuperAdmin();
        source.setPlatformDefault(flag, request.enabled());
        log.info("Platform flag {} set to {} by {}", flag, request.enabled(), caller.subjectId());
        return new FlagStateResponse(flag, null, evaluator.evaluate(flag));
    }

    @PutMapping("/{flag}/tenants/{tenantId}")
    public FlagStateResponse setTenantOverride(
            @PathVariable String flag,
            @PathVariable String tenantId,
            @Valid @RequestBody FlagUpdateRequest request) {
        IdentitySnapshot caller = requireSuperAdmin();
        source.setTenantOverride(tenantId, flag, request.enabled());
        log.info("Tenant {} flag {} set to {} by {}", tenantId, flag, request.enabled(), caller.subjectId());
        return new FlagStateResponse(flag, tenantId, evaluator.evaluate(flag, tenantId));
    }

    @DeleteMapping("/{flag}/tenants/{tenantId}")
    public FlagStateResponse clearTenantOverride(@PathVariable String flag, @PathVariable String tenantId) {
        IdentitySnapshot caller = requireSuperAdmin();
        source.clearTenantOverride(tenantId, flag);
        log.info("Tenant {} override for flag {} cleared by {}", tenantId, flag, caller.subjectId());
        return new FlagStateResponse(flag, tenantId, evaluator.evaluate(flag, tenantId));
    }

    private IdentitySnapshot requireSuperAdmin() {
        IdentitySnapshot caller = identityProvider.currentIdentity();
        if (!RoleChecker.isSuperAdmin(caller)) {
            throw new OperationNotPermittedException("Only a super_admin may change feature flags");
        }
        return caller;
    }
}
