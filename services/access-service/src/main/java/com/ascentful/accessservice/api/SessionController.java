package com.ascentful.accessservice.api;

import com.ascentful.access.AccessEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session lifecycle hook for the identity gateway. The gateway calls it on sign-out or expiry
 * with the identity headers of the session that is ending, so any impersonation it carried is
 * discarded before the same subject signs in again.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final AccessEngine engine;

    public SessionController(AccessEngine engine) {
        this.engine = engine;
    }

    @DeleteMapping("/current")
    public ResponseEntity<Void> endCurrent() {
        boolean discarded = engine.endCurrentSession();
        log.debug("Session end received, overlayDiscarded={}", discarded);
        return ResponseEntity.noContent().build();
    }
}
