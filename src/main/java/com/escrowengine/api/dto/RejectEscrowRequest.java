package com.escrowengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RejectEscrowRequest {

    @NotBlank(message = "Client ID is required")
    private String clientId;

    @NotBlank(message = "Rejection reason is required")
    private String reason;
}
