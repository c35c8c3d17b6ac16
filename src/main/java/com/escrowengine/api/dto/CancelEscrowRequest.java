package com.escrowengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CancelEscrowRequest {

    @NotBlank(message = "Client ID is required")
    private String clientId;

    private String reason;
}
