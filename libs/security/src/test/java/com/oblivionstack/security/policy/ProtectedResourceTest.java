package com.oblivionstack.security.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProtectedResource")
class ProtectedResourceTest {

    @Test
    @DisplayName("parses qualified and bare names")
    void parse() {
        assertThat(ProtectedResource.parse("audit.audit_logs")).isEqualTo(ProtectedResource.of("audit", "audit_logs"));
        assertThat(ProtectedResource.parse("appointments").qualifiedName()).isEqualTo("public.appointments");
    }

    @Test
    @DisplayName("rejects names that are not plain identifiers")
    void rejectsInjection() {
        assertThatThrownBy(() -> ProtectedResource.table("x; drop table y"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProtectedResource.of("Public", "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
