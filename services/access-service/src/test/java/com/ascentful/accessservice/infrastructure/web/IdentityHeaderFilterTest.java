package com.ascentful.accessservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ascentful.access.IdentitySnapshot;
import com.ascentful.access.Plan;
import com.ascentful.access.Role;
import com.ascentful.observability.CorrelationContext;
import com.ascentful.observability.CorrelationContextHolder;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("IdentityHeaderFilter")
class IdentityHeaderFilterTest {

    private final IdentityHeaderFilter filter = new IdentityHeaderFilter(new ObjectMapper());

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        RequestIdentityHolder.clear();
    }

    private static MockHttpServletRequest staffRequest() {
        var request = new MockHttpServletRequest();
        request.addHeader(IdentityHeaders.SUBJECT_ID, "staff-1");
        request.addHeader(IdentityHeaders.ROLE, "staff");
        request.addHeader(IdentityHeaders.SUBSCRIPTION_PLAN, "premium");
        return request;
    }

    @Test
    @DisplayName("binds the caller while the chain runs and clears it afterwards")
    void bindsCaller() throws Exception {
        var seen = new AtomicReference<IdentitySnapshot>();
        FilterChain chain = (req, resp) -> seen.set(new RequestScopedIdentityProvider().currentIdentity());

        filter.doFilter(staffRequest(), new MockHttpServletResponse(), chain);

        assertThat(seen.get().role()).isEqualTo(Role.STAFF);
        assertThat(RequestIdentityHolder.get()).isEmpty();
        assertThat(new RequestScopedIdentityProvider().currentIdentity()).isEqualTo(IdentitySnapshot.absent());
    }

    @Test
    @DisplayName("adds the subject to the correlation context")
    void enrichesCorrelation() throws Exception {
        CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

        filter.doFilter(staffRequest(), new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(CorrelationContextHolder.get().orElseThrow().subjectId()).isEqualTo("staff-1");
    }

    @Test
    @DisplayName("the asserted plan is served for the same subject only")
    void planSource() throws Exception {
        var planSource = new RequestScopedPlanSource(Plan.FREE);
        var own = new AtomicReference<Plan>();
        var other = new AtomicReference<Plan>();
        FilterChain chain = (req, resp) -> {
            own.set(planSource.planFor("staff-1").orElse(null));
            other.set(planSource.planFor("someone-else").orElse(null));
        };

        filter.doFilter(staffRequest(), new MockHttpServletResponse(), chain);

        assertThat(own.get()).isEqualTo(Plan.PREMIUM);
        assertThat(other.get()).isEqualTo(Plan.FREE);
    }

    @Test
    @DisplayName("answers 400 on malformed headers without running the chain")
    void malformed() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(IdentityHeaders.SUBJECT_ID, "x");
        request.addHeader(IdentityHeaders.ROLE, "wizard");
        var response = new MockHttpServletResponse();
        var called = new AtomicBoolean();

        filter.doFilter(request, response, (req, resp) -> called.set(true));

        assertThat(called).isFalse();
        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(response.getContentType()).isEqualTo("application/problem+json");
        assertThat(response.getContentAsString()).contains("Unknown role: wizard");
    }
}
