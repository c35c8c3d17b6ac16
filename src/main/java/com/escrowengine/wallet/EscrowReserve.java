package com.escrowengine.wallet;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Portion of a wallet balance earmarked for one open escrow.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EscrowReserve {

    @Column(name = "escrow_id", nullable = false)
    private String escrowId;

    @Column(name = "reserved_amount", nullable = false)
    private BigDecimal amount;
}
