package com.ascentful.accessservice.api;

import com.ascentful.access.AccessEngine;
import com.ascentful.access.impersonation.ImpersonationOverlay;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Start, stop and inspect the impersonation of the caller's session. Rejections surface as
 * {@code ImpersonationException} and are mapped by the exception handler.
 */
@RestController
@RequestMapping("/api/v1/impersonation")
public class ImpersonationController {

    private final AccessEngine engine;

    public ImpersonationController(AccessEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public OverlayResponse start(@Valid @RequestBody ImpersonationRequest request) {
        ImpersonationOverlay overlay = engine.startImpersonation(request.toTarget()).orElseThrow();
        return OverlayResponse.from(overlay);
    }

    @DeleteMapping
    public ResponseEntity<Void> stop() {
        engine.stopImpersonation();
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public ResponseEntity<OverlayResponse> current() {
        return engine.currentImpersonation()
                .map(overlay -> ResponseEntity.ok(OverlayResponse.from(overlay)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
