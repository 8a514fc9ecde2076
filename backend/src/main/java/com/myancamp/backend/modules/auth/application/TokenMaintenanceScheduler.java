package com.myancamp.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class TokenMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(TokenMaintenanceScheduler.class);

    private final RevocationService revocationService;

    public TokenMaintenanceScheduler(RevocationService revocationService) {
        this.revocationService = revocationService;
    }

    @Scheduled(cron = "${auth.maintenance.blacklist-prune-cron:0 0 * * * *}")
    @Transactional
    public void pruneExpiredBlacklist() {
        int pruned = revocationService.pruneExpiredBlacklist();
        if (pruned > 0) {
            log.info("Pruned {} expired blacklisted access tokens", pruned);
        }
    }
}
