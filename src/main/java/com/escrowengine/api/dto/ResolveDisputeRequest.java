package com.escrowengine.api.dto;

import com.escrowengine.escrow.DisputeOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO carrying the outcome of a dispute decided outside the platform.
 */
@Data
public class ResolveDisputeRequest {

    @NotBlank(message = "Resolver ID is required")
    private String resolvedBy;

    @NotNull(message = "Outcome is required")
    private DisputeOutcome outcome;

    private String resolution;
}
