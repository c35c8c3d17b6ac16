package com.escrowengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StartEscrowRequest {

    @NotBlank(message = "Freelancer ID is required")
    private String freelancerId;
}
