package com.escrowengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Escrow Engine.
 *
 * Escrow Engine holds client funds in trust: clients deposit into a wallet,
 * reserve part of it against an escrow agreement, and the reserved funds are
 * paid to the freelancer only once the delivered work is approved.
 */
@SpringBootApplication
public class EscrowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowEngineApplication.class, args);
    }
}
