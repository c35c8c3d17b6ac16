package com.escrowengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for handing in the work of an escrow.
 */
@Data
public class DeliverEscrowRequest {

    @NotBlank(message = "Freelancer ID is required")
    private String freelancerId;

    @NotBlank(message = "Delivery message is required")
    private String message;

    /**
     * URLs of delivered files.
     */
    private List<String> files = new ArrayList<>();
}
