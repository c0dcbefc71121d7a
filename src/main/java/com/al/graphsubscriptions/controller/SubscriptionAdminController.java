package com.al.graphsubscriptions.controller;

import com.al.graphsubscriptions.dto.RetirementOutcome;
import com.al.graphsubscriptions.model.Subscription;
import com.al.graphsubscriptions.service.SubscriptionAdminService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Tag(name = "Administration")
@SecurityRequirement(name = "basicAuth")
public class SubscriptionAdminController {

    private final SubscriptionAdminService adminService;

    @Operation(summary = "List stored subscriptions of a user")
    @GetMapping("/{userId}/subscriptions")
    public ResponseEntity<List<Subscription>> list(@PathVariable String userId) {
        return ResponseEntity.ok(adminService.listForUser(userId));
    }

    @Operation(summary = "Delete a user's subscriptions at Graph and in the registry")
    @DeleteMapping("/{userId}/subscriptions")
    public ResponseEntity<List<RetirementOutcome>> retire(@PathVariable String userId) {
        return ResponseEntity.ok(adminService.retireForUser(userId));
    }
}
