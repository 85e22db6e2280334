package com.oblivionstack.audit;

import com.oblivionstack.security.BusinessId;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Audit sinks")
class AuditSinksTest {

    private static AuditRecord record(BusinessId business, Instant at) {
        return new AuditRecord(UUID.randomUUID(), "public.appointments", "a1", AuditAction.INSERT, null,
                business.value(), null, Map.of("a", 1), List.of(), null, null, null, at);
    }

    @Test
    @DisplayName("in-memory reader returns the business's newest records first")
    void inMemoryReader() {
        InMemoryAuditSink sink = new InMemoryAuditSink();
        BusinessId business = BusinessId.random();
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        AuditRecord older = record(business, t0);
        AuditRecord newer = record(business, t0.plusSeconds(60));
        sink.write(older);
        sink.write(newer);
        sink.write(record(BusinessId.random(), t0));

        assertThat(sink.findByBusiness(business, 10)).containsExactly(newer, older);
        assertThat(sink.findByBusiness(business, 1)).containsExactly(newer);
    }

    @Test
    @DisplayName("composite sink writes to each delegate and stops at the first failure")
    void composite() {
        List<String> calls = new ArrayList<>();
        AuditSink failing = r -> {
            throw new IllegalStateException("disk full");
        };
        CompositeAuditSink sink = new CompositeAuditSink(List.of(r -> calls.add("first"), failing, r -> calls.add("third")));

        assertThatThrownBy(() -> sink.write(record(BusinessId.random(), Instant.now())))
                .isInstanceOf(IllegalStateException.class);
        assertThat(calls).containsExactly("first");
    }

    @Test
    @DisplayName("logging sink serializes without failing")
    void loggingSink() {
        new LoggingAuditSink().write(record(BusinessId.random(), Instant.now()));
    }
}
