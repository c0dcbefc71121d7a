package com.al.graphsubscriptions.controller;

import com.al.graphsubscriptions.config.SubscriptionProperties;
import com.al.graphsubscriptions.dto.RenewalReport;
import com.al.graphsubscriptions.exception.GlobalExceptionHandler;
import com.al.graphsubscriptions.exception.RegistryException;
import com.al.graphsubscriptions.exception.TokenAcquisitionException;
import com.al.graphsubscriptions.service.SubscriptionRenewalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class RenewalControllerTest {

    @Mock
    private SubscriptionRenewalService renewalService;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        RenewalController controller = new RenewalController(renewalService, new SubscriptionProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void testRenew_DefaultTimeout() throws Exception {
        when(renewalService.runRenewalPass(Duration.ofSeconds(50))).thenReturn(RenewalReport.builder()
                .passId("abc12345")
                .candidates(0)
                .complete(true)
                .message("No subscriptions to renew")
                .build());

        mockMvc.perform(get("/api/cron/renew"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.passId").value("abc12345"))
                .andExpect(jsonPath("$.complete").value(true))
                .andExpect(jsonPath("$.message").value("No subscriptions to renew"));
    }

    @Test
    public void testRenew_ExplicitTimeoutViaPost() throws Exception {
        when(renewalService.runRenewalPass(Duration.ofSeconds(10)))
                .thenReturn(RenewalReport.builder().passId("p").complete(false).unprocessed(4).build());

        mockMvc.perform(post("/api/cron/renew").param("timeoutSeconds", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.complete").value(false))
                .andExpect(jsonPath("$.unprocessed").value(4));
    }

    @Test
    public void testRenew_InvalidTimeout() throws Exception {
        mockMvc.perform(get("/api/cron/renew").param("timeoutSeconds", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/cron/renew").param("timeoutSeconds", "soon"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(renewalService);
    }

    @Test
    public void testRenew_AbortedPassMapsToServerErrors() throws Exception {
        when(renewalService.runRenewalPass(any(Duration.class)))
                .thenThrow(new RegistryException("Could not find subscriptions", null))
                .thenThrow(new TokenAcquisitionException("Could not acquire application token"));

        mockMvc.perform(get("/api/cron/renew"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Registry Unavailable"));
        mockMvc.perform(get("/api/cron/renew"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.path").value("/api/cron/renew"));
    }
}
