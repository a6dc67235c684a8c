package com.ascentful.accessservice.api;

import com.ascentful.access.AccessEngine;
import com.ascentful.access.IdentityProvider;
import com.ascentful.access.IdentityStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Effective identity of the caller: what the rest of the platform should treat them as.
 * 202 while the identity loads, 401 when signed out.
 */
@RestController
@RequestMapping("/api/v1")
public class MeController {

    private final AccessEngine engine;
    private final IdentityProvider identityProvider;

    public MeController(AccessEngine engine, IdentityProvider identityProvider) {
        this.engine = engine;
        this.identityProvider = identityProvider;
    }

    @GetMapping("/me")
    public ResponseEntity<MeResponse> me() {
        if (identityProvider.currentIdentity().status() == IdentityStatus.LOADING) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).build();
        }
        return engine.effectiveIdentity()
                .map(identity -> ResponseEntity.ok(MeResponse.from(identity)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
    }
}
