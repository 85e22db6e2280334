package com.oblivionstack.accessservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.oblivionstack.observability.CorrelationContext;
import com.oblivionstack.observability.CorrelationContextHolder;
import com.oblivionstack.security.BusinessId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("BusinessController tenant tagging")
class BusinessControllerTest {

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("a business id from the path becomes the request's tenantId in the log context")
    void tagsTenant() {
        CorrelationContextHolder.set(CorrelationContext.of("corr-1"));
        BusinessId businessId = BusinessId.random();

        BusinessId parsed = BusinessController.tenant(businessId.toString());

        assertThat(parsed).isEqualTo(businessId);
        assertThat(CorrelationContextHolder.get()).get()
                .extracting(CorrelationContext::tenantId).isEqualTo(businessId.toString());
        assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isEqualTo(businessId.toString());
        assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
    }

    @Test
    @DisplayName("a malformed business id is rejected and leaves the log context untouched")
    void malformedId() {
        CorrelationContextHolder.set(CorrelationContext.of("corr-2"));

        assertThatThrownBy(() -> BusinessController.tenant("not-a-uuid"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
    }
}
