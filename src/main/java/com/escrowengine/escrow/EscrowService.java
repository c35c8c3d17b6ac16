package com.escrowengine.escrow;

import com.escrowengine.common.Currency;
import com.escrowengine.common.Money;
import com.escrowengine.common.exception.InsufficientFundsException;
import com.escrowengine.common.exception.NotFoundException;
import com.escrowengine.common.exception.ValidationException;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.ledger.LedgerService;
import com.escrowengine.ledger.TransactionType;
import com.escrowengine.store.EscrowQuery;
import com.escrowengine.store.LedgerSession;
import com.escrowengine.store.LedgerStore;
import com.escrowengine.wallet.Wallet;
import com.escrowengine.wallet.WalletService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Escrow engine: funds an agreement from the client's wallet and moves the
 * reserved amount to the freelancer or back to the client as the agreement
 * progresses.
 *
 * Lifecycle:
 * 1. create - debit amount plus fee from the client, reserve the amount
 * 2. start / deliver - freelancer side, no money moves
 * 3. approve - pay the freelancer out of the reserve
 * 4. reject - open a dispute, funds stay reserved
 * 5. resolveDispute - refund the client or release to the freelancer
 *
 * A funded escrow may also be cancelled by the client before work starts.
 * The platform fee is never returned.
 */
@Service
@Slf4j
public class EscrowService {

    static final int MAX_PAGE_SIZE = 100;
    static final String SYSTEM_TRANSFER = "system_transfer";

    private final LedgerStore ledgerStore;
    private final WalletService walletService;
    private final LedgerService ledgerService;
    private final BigDecimal platformFeeRate;

    public EscrowService(
            LedgerStore ledgerStore,
            WalletService walletService,
            LedgerService ledgerService,
            @Value("${escrow-engine.escrow.platform-fee-rate:0.05}") BigDecimal platformFeeRate) {
        if (platformFeeRate.signum() < 0 || platformFeeRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Platform fee rate must be in [0, 1): " + platformFeeRate);
        }
        this.ledgerStore = ledgerStore;
        this.walletService = walletService;
        this.ledgerService = ledgerService;
        this.platformFeeRate = platformFeeRate;
    }

    public EscrowCreationResult create(CreateEscrowRequest request) {
        validateCreateRequest(request);

        EscrowCreationResult result = ledgerStore.inTransaction(session -> {
            Wallet client = walletService.lockOrCreate(session, request.getClientId());

            Currency currency = request.getCurrency() == null ? client.getCurrency() : request.getCurrency();
            if (currency != client.getCurrency()) {
                throw new ValidationException(String.format(
                    "Escrow currency %s does not match the client wallet currency %s",
                    currency, client.getCurrency()));
            }

            Money amount = Money.of(request.getAmount(), currency);
            Money platformFee = amount.multiply(platformFeeRate);

            Escrow escrow = new Escrow(
                request.getClientId(),
                request.getFreelancerId(),
                request.getServiceId(),
                request.getServiceName(),
                request.getDescription(),
                amount,
                platformFee,
                request.getPaymentMethodId(),
                request.getTerms(),
                request.getExpiresAt()
            );
            Money total = escrow.getTotal();

            // Funding takes the total out of the balance and then earmarks the amount,
            // so the available balance must cover both.
            Money available = client.getAvailableBalance();
            if (total.isGreaterThan(available)) {
                throw new InsufficientFundsException(client.getUserId(), total, available);
            }
            Money required = total.add(amount);
            if (required.isGreaterThan(available)) {
                throw new InsufficientFundsException(client.getUserId(), required, available);
            }

            client.debit(total);
            client.reserve(escrow.getEscrowId(), amount);
            LedgerEntry transaction = ledgerService.record(session, client, TransactionType.ESCROW,
                total.negate(), request.getPaymentMethodId(),
                "Escrow payment for " + request.getServiceName(), escrow.getEscrowId(), null);

            escrow.markFunded(transaction.getTransactionId());
            session.saveEscrow(escrow);
            session.saveWallet(client);

            return EscrowCreationResult.builder()
                .escrow(escrow)
                .transaction(transaction)
                .platformFee(platformFee)
                .totalAmount(total)
                .build();
        });

        log.info("Escrow {} funded: client={}, freelancer={}, amount={}, fee={}, txn={}",
            result.getEscrow().getEscrowId(), request.getClientId(), request.getFreelancerId(),
            result.getEscrow().getAmount(), result.getPlatformFee(), result.getTransaction().getTransactionId());
        return result;
    }

    public Escrow start(String escrowId, String freelancerId) {
        return transition(escrowId, freelancerId, EscrowAction.START, escrow -> { });
    }

    public Escrow deliver(String escrowId, String freelancerId, String message, List<String> files) {
        requireText(message, "Delivery message is required");
        return transition(escrowId, freelancerId, EscrowAction.DELIVER, escrow -> {
            escrow.setDeliveryMessage(message);
            escrow.setDeliveryFiles(files == null ? new ArrayList<>() : new ArrayList<>(files));
        });
    }

    /**
     * Client accepts the delivery; the reserved amount is paid to the freelancer.
     *
     * @param rating optional, 1 to 5
     */
    public EscrowSettlement approve(String escrowId, String clientId, Integer rating, String feedback) {
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new ValidationException("Rating must be between 1 and 5");
        }
        return settle(escrowId, clientId, EscrowAction.APPROVE, escrow -> {
            escrow.setApprovalRating(rating);
            escrow.setApprovalFeedback(feedback);
        });
    }

    public Escrow reject(String escrowId, String clientId, String reason) {
        requireText(reason, "Rejection reason is required");
        return transition(escrowId, clientId, EscrowAction.REJECT, escrow -> escrow.setDisputeReason(reason));
    }

    /**
     * Close a dispute with the decision taken outside the engine.
     */
    public EscrowSettlement resolveDispute(String escrowId, String resolvedBy, DisputeOutcome outcome,
                                           String resolution) {
        requireText(resolvedBy, "Resolver ID is required");
        if (outcome == null) {
            throw new ValidationException("Dispute outcome is required");
        }
        return settle(escrowId, resolvedBy, outcome.getAction(), escrow -> {
            escrow.setDisputeResolution(resolution);
            escrow.setDisputeResolvedBy(resolvedBy);
        });
    }

    /**
     * Client withdraws a funded escrow before work starts. The amount goes
     * back to the client; the fee is kept.
     */
    public EscrowSettlement cancel(String escrowId, String clientId, String reason) {
        return settle(escrowId, clientId, EscrowAction.CANCEL, escrow -> escrow.setCancellationReason(reason));
    }

    public Escrow getEscrow(String escrowId) {
        requireText(escrowId, "Escrow ID is required");
        return ledgerStore.findEscrow(escrowId)
            .orElseThrow(() -> NotFoundException.escrow(escrowId));
    }

    /**
     * Escrows of a user, newest first.
     *
     * @param role client or freelancer side; null for both
     * @param status optional filter
     */
    public Page<Escrow> listEscrows(String userId, EscrowParty role, EscrowStatus status, int page, int size) {
        requireText(userId, "User ID is required");
        if (role == EscrowParty.ARBITER) {
            throw new ValidationException("Role must be client or freelancer");
        }
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("Page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        EscrowQuery query = EscrowQuery.builder().userId(userId).role(role).status(status).build();
        return ledgerStore.listEscrows(query, PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    /**
     * Status-only transition: no wallet is touched.
     */
    private Escrow transition(String escrowId, String callerId, EscrowAction action, Consumer<Escrow> payload) {
        requireText(escrowId, "Escrow ID is required");
        requireText(callerId, "Caller ID is required");

        Escrow escrow = ledgerStore.inTransaction(session -> {
            Escrow locked = lockEscrow(session, escrowId);
            locked.authorize(action, callerId);
            locked.apply(action);
            payload.accept(locked);
            return session.saveEscrow(locked);
        });

        log.info("Escrow {} {} by {}: now {}", escrowId, action.getVerb(), callerId, escrow.getStatus().getCode());
        return escrow;
    }

    /**
     * Transition that closes the escrow and pays out its reserve. Escrow first,
     * then both wallets in user id order.
     */
    private EscrowSettlement settle(String escrowId, String callerId, EscrowAction action, Consumer<Escrow> payload) {
        requireText(escrowId, "Escrow ID is required");
        requireText(callerId, "Caller ID is required");

        EscrowSettlement settlement = ledgerStore.inTransaction(session -> {
            Escrow escrow = lockEscrow(session, escrowId);
            escrow.authorize(action, callerId);
            EscrowStatus previous = escrow.getStatus();
            escrow.apply(action);
            payload.accept(escrow);
            if (!previous.holdsReserve() || !escrow.getStatus().isTerminal()) {
                throw new IllegalStateException(String.format(
                    "%s cannot settle escrow %s: %s -> %s", action, escrowId, previous, escrow.getStatus()));
            }

            Wallet client = null;
            Wallet freelancer = null;
            for (String userId : lockOrder(escrow.getClientId(), escrow.getFreelancerId())) {
                Wallet wallet = walletService.lockOrCreate(session, userId);
                if (userId.equals(escrow.getClientId())) {
                    client = wallet;
                } else {
                    freelancer = wallet;
                }
            }

            Money released = client.releaseReserve(escrowId);
            if (!released.isSameAmount(escrow.getAmount())) {
                throw new IllegalStateException(String.format(
                    "Reserve of escrow %s holds %s, expected %s", escrowId, released, escrow.getAmount()));
            }

            Wallet payee = switch (action) {
                case APPROVE, RELEASE -> freelancer;
                case REFUND, CANCEL -> client;
                case START, DELIVER, REJECT -> throw new IllegalArgumentException(
                    "Action does not settle an escrow: " + action);
            };
            TransactionType type = payee == client ? TransactionType.REFUND : TransactionType.PAYMENT;
            String description = switch (action) {
                case CANCEL -> "Cancelled escrow: " + escrow.getServiceName();
                case REFUND -> "Dispute refund: " + escrow.getServiceName();
                default -> "Payment for completed work: " + escrow.getServiceName();
            };

            payee.credit(escrow.getAmount());
            LedgerEntry transaction = ledgerService.record(session, payee, type, escrow.getAmount(),
                SYSTEM_TRANSFER, description, escrowId, null);

            session.saveEscrow(escrow);
            session.saveWallet(client);
            session.saveWallet(freelancer);

            return EscrowSettlement.builder()
                .escrow(escrow)
                .transaction(transaction)
                .build();
        });

        log.info("Escrow {} {} by {}: {} paid to {}, txn={}",
            escrowId, action.getVerb(), callerId, settlement.getTransaction().getAmount(),
            settlement.getTransaction().getUserId(), settlement.getTransaction().getTransactionId());
        return settlement;
    }

    private Escrow lockEscrow(LedgerSession session, String escrowId) {
        return session.lockEscrow(escrowId)
            .orElseThrow(() -> NotFoundException.escrow(escrowId));
    }

    private static List<String> lockOrder(String first, String second) {
        return first.compareTo(second) <= 0 ? List.of(first, second) : List.of(second, first);
    }

    private void validateCreateRequest(CreateEscrowRequest request) {
        if (request == null) {
            throw new ValidationException("Escrow request is required");
        }
        requireText(request.getClientId(), "Client ID is required");
        requireText(request.getFreelancerId(), "Freelancer ID is required");
        requireText(request.getServiceName(), "Service name is required");
        requireText(request.getDescription(), "Description is required");
        requireText(request.getPaymentMethodId(), "Payment method ID is required");
        if (request.getAmount() == null || request.getAmount().signum() <= 0) {
            throw new ValidationException("Amount must be greater than zero");
        }
        if (!Money.hasCentPrecision(request.getAmount())) {
            throw new ValidationException("Amount cannot have more than 2 decimal places");
        }
        if (request.getClientId().equals(request.getFreelancerId())) {
            throw new ValidationException("Client and freelancer must be different users");
        }
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
    }
}
