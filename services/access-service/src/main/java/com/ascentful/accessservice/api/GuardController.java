package com.ascentful.accessservice.api;

import com.ascentful.access.AccessEngine;
import com.ascentful.access.Decision;
import com.ascentful.access.GuardEnforcer;
import com.ascentful.access.GuardOutcomeHandler;
import com.ascentful.access.StandardGuards;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Guard evaluation for the caller of the request.
 *
 * <p>{@code GET /guards/{name}} behaves like a protected page: 200 when allowed, 202 while a
 * dependency is still loading, 303 to the redirect path when denied.
 */
@RestController
@RequestMapping("/api/v1/guards")
public class GuardController {

    private static final GuardOutcomeHandler<ResponseEntity<DecisionResponse>> HTTP_OUTCOMES =
            new GuardOutcomeHandler<>() {
                @Override
                public ResponseEntity<DecisionResponse> onPending(Decision decision) {
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(DecisionResponse.from(decision));
                }

                @Override
                public ResponseEntity<DecisionResponse> onRedirect(String redirectPath, Decision decision) {
                    return ResponseEntity.status(HttpStatus.SEE_OTHER)
                            .location(URI.create(redirectPath))
                            .body(DecisionResponse.from(decision));
                }
            };

    private final AccessEngine engine;
    private final GuardEnforcer enforcer;

    public GuardController(AccessEngine engine, GuardEnforcer enforcer) {
        this.engine = engine;
        this.enforcer = enforcer;
    }

    @PostMapping("/evaluate")
    public DecisionResponse evaluate(@Valid @RequestBody GuardRequest request) {
        return DecisionResponse.from(engine.evaluateGuard(request.toSpec()));
    }

    @GetMapping("/{name}")
    public ResponseEntity<DecisionResponse> enter(@PathVariable String name) {
        return StandardGuards.byName(name)
                .map(spec -> enforcer.enforce(
                        spec, () -> ResponseEntity.ok(DecisionResponse.from(Decision.allow())), HTTP_OUTCOMES))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
