package com.al.graphsubscriptions.service;

import com.al.graphsubscriptions.dto.RenewalReport;
import com.al.graphsubscriptions.exception.RegistryException;
import com.al.graphsubscriptions.exception.TokenAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Timer trigger for the renewal pass. Assumes a single active instance per deployment.
 */
@Component
@Slf4j
public class SubscriptionRenewalScheduler {

    private final SubscriptionRenewalService renewalService;

    public SubscriptionRenewalScheduler(SubscriptionRenewalService renewalService) {
        this.renewalService = renewalService;
    }

    @Scheduled(fixedRateString = "${app.subscriptions.renewal-interval:PT30M}",
            initialDelayString = "${app.subscriptions.initial-delay:PT1M}")
    public void renewExpiringSubscriptions() {
        try {
            RenewalReport report = renewalService.runRenewalPass();
            log.debug("Scheduled renewal pass {} processed {} candidate(s)", report.getPassId(),
                    report.getCandidates());
        } catch (TokenAcquisitionException | RegistryException e) {
            log.error("Scheduled renewal pass aborted: {}", e.getMessage(), e);
        }
    }
}
