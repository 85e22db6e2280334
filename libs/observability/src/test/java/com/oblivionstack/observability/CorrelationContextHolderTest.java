package com.oblivionstack.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set / get / clear")
    class Lifecycle {

        @Test
        @DisplayName("populates MDC from the context")
        void populatesMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "biz-1", "user-1", "req-1"));

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isEqualTo("biz-1");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("user-1");
            assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isEqualTo("req-1");
        }

        @Test
        @DisplayName("null fields are removed from MDC rather than stored")
        void nullFieldsRemoved() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "biz-1", "user-1", null));
            CorrelationContextHolder.set(CorrelationContext.of("corr-2"));

            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
        }

        @Test
        @DisplayName("clear removes context and MDC keys")
        void clearRemovesEverything() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "biz-1", "user-1", "req-1"));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("context rejects blank correlation ID")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> CorrelationContext.of(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("update()")
    class Update {

        @Test
        @DisplayName("adds the resolved user to the current context")
        void addsUser() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

            CorrelationContextHolder.update(ctx -> ctx.withUserId("user-9"));

            assertThat(CorrelationContextHolder.get()).get()
                    .extracting(CorrelationContext::userId).isEqualTo("user-9");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("user-9");
        }

        @Test
        @DisplayName("does nothing when no context is set")
        void noContext() {
            CorrelationContextHolder.update(ctx -> ctx.withTenantId("biz-1"));

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("runWithContext()")
    class RunWithContext {

        @Test
        @DisplayName("restores the previous context afterwards")
        void restoresPrevious() {
            CorrelationContextHolder.set(CorrelationContext.of("outer"));
            var seen = new AtomicReference<String>();

            CorrelationContextHolder.runWithContext(CorrelationContext.of("inner"),
                    () -> seen.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID)));

            assertThat(seen.get()).isEqualTo("inner");
            assertThat(CorrelationContextHolder.get()).get()
                    .extracting(CorrelationContext::correlationId).isEqualTo("outer");
        }

        @Test
        @DisplayName("clears when there was no previous context")
        void clearsWhenNoPrevious() {
            CorrelationContextHolder.runWithContext(CorrelationContext.of("inner"), () -> { });

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }
}
