package com.escrowengine.api.controller;

import com.escrowengine.api.dto.ApproveEscrowRequest;
import com.escrowengine.api.dto.CancelEscrowRequest;
import com.escrowengine.api.dto.DeliverEscrowRequest;
import com.escrowengine.api.dto.FundEscrowRequest;
import com.escrowengine.api.dto.RejectEscrowRequest;
import com.escrowengine.api.dto.ResolveDisputeRequest;
import com.escrowengine.api.dto.StartEscrowRequest;
import com.escrowengine.escrow.Escrow;
import com.escrowengine.escrow.EscrowCreationResult;
import com.escrowengine.escrow.EscrowParty;
import com.escrowengine.escrow.EscrowService;
import com.escrowengine.escrow.EscrowSettlement;
import com.escrowengine.escrow.EscrowStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the escrow lifecycle.
 */
@RestController
@RequestMapping("/api/v1/escrows")
@RequiredArgsConstructor
@Tag(name = "Escrows", description = "Escrow lifecycle API")
public class EscrowController {

    private final EscrowService escrowService;

    @PostMapping
    @Operation(summary = "Create an escrow funded from the client's wallet")
    public ResponseEntity<EscrowCreationResult> createEscrow(@Valid @RequestBody FundEscrowRequest request) {
        EscrowCreationResult result = escrowService.create(request.toCreateEscrowRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/{escrowId}")
    @Operation(summary = "Get escrow details")
    public ResponseEntity<Escrow> getEscrow(@PathVariable String escrowId) {
        return ResponseEntity.ok(escrowService.getEscrow(escrowId));
    }

    @GetMapping("/user/{userId}")
    @Operation(summary = "List a user's escrows, newest first")
    public ResponseEntity<Page<Escrow>> getUserEscrows(
            @PathVariable String userId,
            @RequestParam(required = false) EscrowParty role,
            @RequestParam(required = false) EscrowStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size) {
        return ResponseEntity.ok(escrowService.listEscrows(userId, role, status, page, size));
    }

    @PostMapping("/{escrowId}/start")
    @Operation(summary = "Freelancer starts work")
    public ResponseEntity<Escrow> start(
            @PathVariable String escrowId,
            @Valid @RequestBody StartEscrowRequest request) {
        return ResponseEntity.ok(escrowService.start(escrowId, request.getFreelancerId()));
    }

    @PostMapping("/{escrowId}/deliver")
    @Operation(summary = "Freelancer delivers the work")
    public ResponseEntity<Escrow> deliver(
            @PathVariable String escrowId,
            @Valid @RequestBody DeliverEscrowRequest request) {
        return ResponseEntity.ok(escrowService.deliver(
            escrowId, request.getFreelancerId(), request.getMessage(), request.getFiles()));
    }

    @PostMapping("/{escrowId}/approve")
    @Operation(summary = "Client approves the delivery and pays the freelancer")
    public ResponseEntity<EscrowSettlement> approve(
            @PathVariable String escrowId,
            @Valid @RequestBody ApproveEscrowRequest request) {
        return ResponseEntity.ok(escrowService.approve(
            escrowId, request.getClientId(), request.getRating(), request.getFeedback()));
    }

    @PostMapping("/{escrowId}/reject")
    @Operation(summary = "Client rejects the delivery and opens a dispute")
    public ResponseEntity<Escrow> reject(
            @PathVariable String escrowId,
            @Valid @RequestBody RejectEscrowRequest request) {
        return ResponseEntity.ok(escrowService.reject(escrowId, request.getClientId(), request.getReason()));
    }

    @PostMapping("/{escrowId}/cancel")
    @Operation(summary = "Client cancels a funded escrow before work starts")
    public ResponseEntity<EscrowSettlement> cancel(
            @PathVariable String escrowId,
            @Valid @RequestBody CancelEscrowRequest request) {
        return ResponseEntity.ok(escrowService.cancel(escrowId, request.getClientId(), request.getReason()));
    }

    @PostMapping("/{escrowId}/resolve")
    @Operation(summary = "Record the outcome of a dispute")
    public ResponseEntity<EscrowSettlement> resolve(
            @PathVariable String escrowId,
            @Valid @RequestBody ResolveDisputeRequest request) {
        return ResponseEntity.ok(escrowService.resolveDispute(
            escrowId, request.getResolvedBy(), request.getOutcome(), request.getResolution()));
    }
}
