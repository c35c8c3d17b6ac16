package com.escrowengine.gateway;

import com.escrowengine.common.Money;
import com.escrowengine.common.exception.PaymentDeclinedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * Mock payment gateway for development and tests.
 *
 * Approves every charge except those on tokens listed in
 * {@code escrow-engine.gateway.mock.declined-tokens}.
 */
@Component
@ConditionalOnProperty(name = "escrow-engine.gateway.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MockPaymentGateway implements PaymentGateway {

    private final Set<String> declinedTokens;

    public MockPaymentGateway(@Value("${escrow-engine.gateway.mock.declined-tokens:}") Set<String> declinedTokens) {
        this.declinedTokens = declinedTokens;
    }

    @Override
    public String authorize(String cardToken, Money amount) {
        if (declinedTokens.contains(cardToken)) {
            log.info("MockPaymentGateway: declining charge of {} on token {}", amount, cardToken);
            throw new PaymentDeclinedException("Card declined by issuer");
        }
        String reference = "ch_" + UUID.randomUUID().toString().replace("-", "");
        log.info("MockPaymentGateway: authorized charge of {} on token {}, reference={}",
            amount, cardToken, reference);
        return reference;
    }

    @Override
    public String getGatewayName() {
        return "MockGateway";
    }
}
