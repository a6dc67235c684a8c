package com.ascentful.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge,
 * in-place updates and scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "user-1", null, "org-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank correlation id")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> CorrelationContext.of(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "user-1", "admin-1", "org-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("subjectId")).isEqualTo("user-1");
            assertThat(MDC.get("actingAdminId")).isEqualTo("admin-1");
            assertThat(MDC.get("organizationId")).isEqualTo("org-1");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "user-1", "admin-1", "org-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("subjectId")).isNull();
            assertThat(MDC.get("actingAdminId")).isNull();
            assertThat(MDC.get("organizationId")).isNull();
        }

        @Test
        @DisplayName("update() rebinds MDC to the new values")
        void updateRebindsMdc() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

            CorrelationContextHolder.update(ctx -> ctx.withSubject("user-9", null).withActingAdmin("admin-2"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("subjectId")).isEqualTo("user-9");
            assertThat(MDC.get("actingAdminId")).isEqualTo("admin-2");
            assertThat(MDC.get("organizationId")).isNull();
        }

        @Test
        @DisplayName("update() without a context is a no-op")
        void updateWithoutContext() {
            CorrelationContextHolder.update(ctx -> ctx.withActingAdmin("admin-2"));

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("actingAdminId")).isNull();
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("should set context for the duration of the runnable and restore afterwards")
        void shouldSetContextAndRestore() {
            CorrelationContextHolder.set(CorrelationContext.of("outer-corr"));

            AtomicReference<String> captured = new AtomicReference<>();
            CorrelationContextHolder.runWithContext(CorrelationContext.of("inner-corr"), () ->
                    captured.set(CorrelationContextHolder.get()
                            .map(CorrelationContext::correlationId).orElse(null)));

            assertThat(captured.get()).isEqualTo("inner-corr");
            assertThat(CorrelationContextHolder.get().orElseThrow().correlationId()).isEqualTo("outer-corr");
        }

        @Test
        @DisplayName("should clear context after runnable when no previous context existed")
        void shouldClearWhenNoPreviousContext() {
            CorrelationContextHolder.runWithContext(CorrelationContext.of("temp-corr"), () ->
                    assertThat(CorrelationContextHolder.get()).isPresent());

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should not leak context across threads")
        void shouldNotLeakAcrossThreads() throws InterruptedException {
            CorrelationContextHolder.set(CorrelationContext.of("main-corr"));

            AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
            Thread other = new Thread(() -> otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
            other.start();
            other.join();

            assertThat(otherThreadHasContext.get()).isFalse();
        }
    }
}
