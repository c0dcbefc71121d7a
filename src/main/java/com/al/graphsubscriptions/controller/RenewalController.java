package com.al.graphsubscriptions.controller;

import com.al.graphsubscriptions.config.SubscriptionProperties;
import com.al.graphsubscriptions.dto.RenewalReport;
import com.al.graphsubscriptions.service.SubscriptionRenewalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * External trigger for a renewal pass, for deployments where an outside scheduler drives renewal instead of
 * (or as well as) the in-process timer. Both run the same pass.
 */
@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
@Tag(name = "Renewal")
@Slf4j
public class RenewalController {

    private final SubscriptionRenewalService renewalService;
    private final SubscriptionProperties subscriptionProperties;

    @Operation(summary = "Renew subscriptions expiring within the lookahead window")
    @RequestMapping(value = "/renew", method = { RequestMethod.GET, RequestMethod.POST })
    public ResponseEntity<RenewalReport> renew(
            @RequestParam(value = "timeoutSeconds", required = false) Long timeoutSeconds) {
        Duration timeout = subscriptionProperties.getOnDemandTimeout();
        if (timeoutSeconds != null) {
            if (timeoutSeconds <= 0) {
                throw new IllegalArgumentException("timeoutSeconds must be positive");
            }
            timeout = Duration.ofSeconds(timeoutSeconds);
        }
        log.info("On-demand renewal pass requested (timeout {})", timeout);
        return ResponseEntity.ok(renewalService.runRenewalPass(timeout));
    }
}
