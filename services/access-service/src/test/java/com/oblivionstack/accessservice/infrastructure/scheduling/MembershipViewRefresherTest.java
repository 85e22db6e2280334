package com.oblivionstack.accessservice.infrastructure.scheduling;

import static org.assertj.core.api.Assertions.assertThat;

import com.oblivionstack.accessservice.config.AccessServiceProperties;
import com.oblivionstack.observability.MetricFactory;
import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.CachedMembershipView;
import com.oblivionstack.security.membership.CachedMembershipView.RefreshOutcome;
import com.oblivionstack.security.membership.InMemoryMembershipRepository;
import com.oblivionstack.security.membership.Membership;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MembershipViewRefresher")
class MembershipViewRefresherTest {

    private final InMemoryMembershipRepository repository = new InMemoryMembershipRepository();
    private final CachedMembershipView view =
            new CachedMembershipView(repository, new MetricFactory(new SimpleMeterRegistry(), "test"));

    private MembershipViewRefresher refresher(boolean onStartup) {
        return new MembershipViewRefresher(view, new AccessServiceProperties(null,
                new AccessServiceProperties.MembershipView(Duration.ofMinutes(1), onStartup), List.of()));
    }

    @Test
    @DisplayName("refresh rebuilds the view from the repository")
    void refresh() {
        repository.insert(Membership.active(BusinessId.random(), UserId.random(), Role.STAFF, Instant.now()));

        assertThat(refresher(false).refresh().outcome()).isEqualTo(RefreshOutcome.REFRESHED);
        assertThat(view.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("builds the view when the application is ready, if configured to")
    void startup() {
        refresher(false).onApplicationReady();
        assertThat(view.refreshedAt()).isEmpty();

        refresher(true).onApplicationReady();
        assertThat(view.refreshedAt()).isPresent();
    }
}
