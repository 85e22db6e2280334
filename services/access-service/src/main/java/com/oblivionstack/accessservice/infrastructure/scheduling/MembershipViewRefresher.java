package com.oblivionstack.accessservice.infrastructure.scheduling;

import com.oblivionstack.accessservice.config.AccessServiceProperties;
import com.oblivionstack.security.membership.CachedMembershipView;
import com.oblivionstack.security.membership.CachedMembershipView.RefreshResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the {@link CachedMembershipView} on a fixed delay, and once when the application is
 * ready unless {@code oblivion.access.membership-view.refresh-on-startup} is false.
 */
@Component
public class MembershipViewRefresher {

    private static final Logger log = LoggerFactory.getLogger(MembershipViewRefresher.class);

    private final CachedMembershipView view;
    private final AccessServiceProperties properties;

    public MembershipViewRefresher(CachedMembershipView view, AccessServiceProperties properties) {
        this.view = view;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.membershipView().refreshOnStartup()) {
            refresh();
        }
    }

    @Scheduled(
            fixedDelayString = "${oblivion.access.membership-view.refresh-interval:PT5M}",
            initialDelayString = "${oblivion.access.membership-view.refresh-interval:PT5M}")
    public RefreshResult refresh() {
        RefreshResult result = view.refresh();
        log.debug("Scheduled membership view refresh: {} ({} entries)", result.outcome(), result.entries());
        return result;
    }
}
