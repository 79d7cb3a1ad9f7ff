package com.agrinova.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class TokenMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(TokenMaintenanceScheduler.class);

    private final JwtTokenService jwtTokenService;

    public TokenMaintenanceScheduler(JwtTokenService jwtTokenService) {
        this.jwtTokenService = jwtTokenService;
    }

    @Scheduled(fixedDelayString = "${agrinova.tokens.purge-interval:PT10M}")
    public void purgeExpired() {
        int markers = jwtTokenService.purgeExpiredMarkers();
        int lineages = jwtTokenService.deleteExpiredLineages();
        if (markers > 0 || lineages > 0) {
            log.info("Purged {} revocation markers and {} expired session lineages", markers, lineages);
        }
    }
}
