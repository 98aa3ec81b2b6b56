package lab.escrow.orchestration;

import lab.escrow.adapter.ValueLedger;
import lab.escrow.common.EscrowErrorCode;
import lab.escrow.common.EscrowException;
import lab.escrow.common.KeyedLocks;
import lab.escrow.domain.review.ItemReview;
import lab.escrow.domain.transaction.EscrowTransaction;
import lab.escrow.domain.transaction.EscrowTransactionRepository;
import lab.escrow.domain.transaction.TransactionStatus;
import lab.escrow.orchestration.policy.AuthorizationGuard;
import lab.escrow.orchestration.policy.DeadlinePolicy;
import lab.escrow.orchestration.policy.RatingPolicy;
import lab.escrow.orchestration.policy.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.BiConsumer;

/**
 * Lifecycle engine for escrow transactions.
 *
 * <p>Every mutating operation runs under a per-transaction lock inside one database transaction.
 * Checks run in a fixed order (role, deadline, state) against the loaded record, and nothing is
 * changed until all of them pass. Value leaves custody only through the ledger, before the
 * record is updated, so a failed transfer leaves both untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    static final String MDC_TRANSACTION_ID_KEY = "transactionId";

    private final EscrowTransactionRepository transactionRepository;
    private final AuthorizationGuard authorizationGuard;
    private final DeadlinePolicy deadlinePolicy;
    private final RatingPolicy ratingPolicy;
    private final ValueLedger valueLedger;
    private final ReviewService reviewService;
    private final StoreStatisticsService storeStatisticsService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks<UUID> transactionLocks = new KeyedLocks<>();

    @Autowired(required = false)
    private TransactionEventSink eventSink;

    public EscrowTransaction createTransaction(String principal, String item, long quantity, long price, Duration duration) {
        log.info(
                "event=transaction_service.create.start customer={} item={} quantity={} price={} durationMs={}",
                principal,
                item,
                quantity,
                price,
                duration == null ? null : duration.toMillis()
        );
        requirePrincipal(principal);
        requireItem(item);
        requireNonNegative("quantity", quantity);
        requireNonNegative("price", price);
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "duration must be positive");
        }

        EscrowTransaction created = transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            EscrowTransaction saved = transactionRepository.save(
                    EscrowTransaction.open(principal, item, quantity, price, duration, now));
            publish(saved, "CREATED", principal, now);
            return saved;
        });
        if (created == null) {
            throw new IllegalStateException("failed to create transaction");
        }
        log.info(
                "event=transaction_service.create.done transactionId={} status={} deadline={}",
                created.getId(),
                created.getStatus(),
                created.getDeadline()
        );
        return created;
    }

    public EscrowTransaction acceptTransaction(UUID id, String principal) {
        return mutate(id, "ACCEPTED", principal, (tx, now) -> {
            requirePrincipal(principal);
            if (tx.isCustomer(principal)) {
                throw new EscrowException(EscrowErrorCode.INVALID_TRANSACTION, "customer cannot accept own transaction");
            }
            requireNoStore(tx, "accept");
            tx.accept(principal, now);
        });
    }

    public EscrowTransaction fulfillTransaction(UUID id, String principal) {
        return mutate(id, "FULFILLED", principal, (tx, now) -> applyFulfilment(tx, principal, now, EscrowErrorCode.INVALID_ITEM));
    }

    // Same fulfilment path and deadline rule as fulfillTransaction; only the denial code differs.
    public EscrowTransaction markComplete(UUID id, String principal) {
        return mutate(id, "MARKED_COMPLETE", principal, (tx, now) -> applyFulfilment(tx, principal, now, EscrowErrorCode.NOT_STORE));
    }

    public EscrowTransaction disputeTransaction(UUID id, String principal) {
        return mutate(id, "DISPUTED", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.CUSTOMER_ONLY, tx, EscrowErrorCode.DISPUTE);
            requireStore(tx, "dispute");
            tx.openDispute(now);
        });
    }

    public EscrowTransaction resolveDispute(UUID id, String principal, boolean resolved) {
        return mutate(id, resolved ? "DISPUTE_RESOLVED_FOR_STORE" : "DISPUTE_RESOLVED_FOR_CUSTOMER", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.CUSTOMER_OR_STORE, tx, EscrowErrorCode.DISPUTE);
            if (!tx.isDispute()) {
                throw new EscrowException(EscrowErrorCode.ALREADY_RESOLVED, "no open dispute on transaction " + tx.getId());
            }
            String store = requireStore(tx, "resolve dispute");
            String beneficiary = resolved ? store : tx.getCustomer();
            long released = releaseAll(tx, beneficiary);
            tx.resetEpisode(TransactionStatus.RESOLVED, now);
            log.info(
                    "event=transaction_service.dispute.resolved transactionId={} resolvedForStore={} beneficiary={} amount={}",
                    tx.getId(),
                    resolved,
                    beneficiary,
                    released
            );
        });
    }

    public EscrowTransaction releasePayment(UUID id, String principal, String review, Integer rating) {
        return mutate(id, "PAYMENT_RELEASED", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.CUSTOMER_ONLY, tx, EscrowErrorCode.NOT_STORE);
            int validRating = ratingPolicy.require(rating);
            if (review != null && review.length() > ItemReview.MAX_REVIEW_TEXT_LENGTH) {
                throw new EscrowException(
                        EscrowErrorCode.INVALID_REQUEST,
                        "review must not exceed " + ItemReview.MAX_REVIEW_TEXT_LENGTH + " characters"
                );
            }
            deadlinePolicy.requireAfter(now, tx.getDeadline(), "release payment");
            String store = requireStore(tx, "release payment");
            if (!tx.isFulfilled()) {
                throw new EscrowException(EscrowErrorCode.INVALID_TRANSACTION, "transaction has not been fulfilled");
            }
            if (tx.isDispute()) {
                throw new EscrowException(EscrowErrorCode.INVALID_TRANSACTION, "transaction has an open dispute");
            }
            if (tx.getEscrow().isEmpty()) {
                throw new EscrowException(EscrowErrorCode.INSUFFICIENT_ESCROW, "no escrow to release");
            }

            long released = releaseAll(tx, store);
            tx.rate(validRating, now);
            reviewService.recordReview(tx.getId(), tx.getCustomer(), store, review, validRating, now);
            afterCommit(() -> storeStatisticsService.recordSale(store, released, validRating, now));
            tx.resetEpisode(TransactionStatus.COMPLETED, now);
            log.info("event=transaction_service.payment.released transactionId={} store={} amount={}", tx.getId(), store, released);
        });
    }

    public EscrowTransaction addFunds(UUID id, String principal, long amount) {
        return mutate(id, "FUNDS_ADDED", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.CUSTOMER_ONLY, tx, EscrowErrorCode.NOT_STORE);
            if (amount <= 0) {
                throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "amount must be positive: " + amount);
            }
            valueLedger.depositIntoCustody(tx.getId(), principal, amount);
            tx.getEscrow().deposit(amount);
            tx.touch(now);
        });
    }

    /**
     * Refunds the customer when a store is assigned and ends the episode.
     *
     * <p>Unlike a plain "cancel always resets", cancel is rejected with {@code INVALID_WITHDRAWAL}
     * once the store has fulfilled or a dispute is open. Resetting then would clear the store while
     * escrow is still held, and a later refund would hand delivered goods' payment back to the customer.
     */
    public EscrowTransaction cancelTransaction(UUID id, String principal) {
        return mutate(id, "CANCELLED", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.CUSTOMER_OR_STORE, tx, EscrowErrorCode.NOT_STORE);
            requireNotLockedIn(tx, "cancel");
            if (tx.getStore().isPresent()) {
                releaseAll(tx, tx.getCustomer());
            }
            tx.resetEpisode(TransactionStatus.CANCELLED, now);
        });
    }

    public EscrowTransaction requestRefund(UUID id, String principal) {
        return mutate(id, "REFUNDED", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.CUSTOMER_ONLY, tx, EscrowErrorCode.NOT_STORE);
            requireNotLockedIn(tx, "refund");
            releaseAll(tx, tx.getCustomer());
            tx.resetEpisode(TransactionStatus.REFUNDED, now);
        });
    }

    public EscrowTransaction rateStore(UUID id, String principal, Integer rating) {
        return mutate(id, "RATED", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.CUSTOMER_ONLY, tx, EscrowErrorCode.NOT_STORE);
            int validRating = ratingPolicy.require(rating);
            if (tx.getRating().isPresent()) {
                throw new EscrowException(EscrowErrorCode.INVALID_RATING, "transaction already rated in this episode");
            }
            tx.rate(validRating, now);
        });
    }

    public EscrowTransaction updateItem(UUID id, String principal, String item) {
        return mutate(id, "ITEM_UPDATED", principal, (tx, now) -> {
            requireDetailUpdate(tx, principal);
            requireItem(item);
            tx.changeItem(item, now);
        });
    }

    public EscrowTransaction updatePrice(UUID id, String principal, long price) {
        return mutate(id, "PRICE_UPDATED", principal, (tx, now) -> {
            requireDetailUpdate(tx, principal);
            requireNonNegative("price", price);
            tx.changePrice(price, now);
        });
    }

    public EscrowTransaction updateQuantity(UUID id, String principal, long quantity) {
        return mutate(id, "QUANTITY_UPDATED", principal, (tx, now) -> {
            requireDetailUpdate(tx, principal);
            requireNonNegative("quantity", quantity);
            tx.changeQuantity(quantity, now);
        });
    }

    public EscrowTransaction updateDeadline(UUID id, String principal, Instant deadline) {
        return mutate(id, "DEADLINE_UPDATED", principal, (tx, now) -> {
            requireDetailUpdate(tx, principal);
            if (deadline == null || !deadline.isAfter(tx.getCreatedAt())) {
                throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "deadline must be after creation time: " + deadline);
            }
            tx.changeDeadline(deadline, now);
        });
    }

    public EscrowTransaction updateStatus(UUID id, String principal, TransactionStatus status) {
        return mutate(id, "STATUS_UPDATED", principal, (tx, now) -> {
            requireDetailUpdate(tx, principal);
            if (status == null) {
                throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "status is required");
            }
            if (status != TransactionStatus.OPEN && status != TransactionStatus.CANCELLED) {
                throw new EscrowException(EscrowErrorCode.INVALID_TRANSACTION, "status cannot be set directly to " + status);
            }
            tx.transitionTo(status, now);
        });
    }

    public EscrowTransaction extendDeadline(UUID id, String principal, Duration extension) {
        return mutate(id, "DEADLINE_EXTENDED", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.STORE_ONLY, tx, EscrowErrorCode.NOT_STORE);
            if (extension == null || extension.isNegative()) {
                throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "extension must not be negative");
            }
            tx.extendDeadline(extension, now);
        });
    }

    public EscrowTransaction partialRefund(UUID id, String principal, long amount) {
        return mutate(id, "PARTIAL_REFUND", principal, (tx, now) -> {
            authorizationGuard.require(principal, Role.STORE_ONLY, tx, EscrowErrorCode.NOT_STORE);
            if (amount <= 0) {
                throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "amount must be positive: " + amount);
            }
            long held = tx.getEscrow().getBalance();
            if (amount > held) {
                throw new EscrowException(
                        EscrowErrorCode.INSUFFICIENT_ESCROW,
                        "partial refund exceeds escrow: requested=" + amount + ", balance=" + held
                );
            }
            valueLedger.transfer(tx.getId(), tx.getCustomer(), amount);
            tx.getEscrow().withdraw(amount);
            tx.touch(now);
        });
    }

    @Transactional(readOnly = true)
    public EscrowTransaction get(UUID id) {
        return load(id);
    }

    @Transactional(readOnly = true)
    public TransactionDetails getDetails(UUID id) {
        return TransactionDetails.from(load(id));
    }

    @Transactional(readOnly = true)
    public String getItem(UUID id) {
        return load(id).getItem();
    }

    @Transactional(readOnly = true)
    public long getPrice(UUID id) {
        return load(id).getPrice();
    }

    @Transactional(readOnly = true)
    public TransactionStatus getStatus(UUID id) {
        return load(id).getStatus();
    }

    @Transactional(readOnly = true)
    public Instant getDeadline(UUID id) {
        return load(id).getDeadline();
    }

    @Transactional(readOnly = true)
    public List<EscrowTransaction> listByCustomer(String customer) {
        return transactionRepository.findByCustomerOrderByCreatedAtAsc(customer);
    }

    @Transactional(readOnly = true)
    public List<EscrowTransaction> listByStore(String store) {
        return transactionRepository.findByStoreOrderByCreatedAtAsc(store);
    }

    // Serializes operations on one transaction and applies the change inside a single unit of work.
    private EscrowTransaction mutate(UUID id, String action, String principal, BiConsumer<EscrowTransaction, Instant> operation) {
        return transactionLocks.withLock(id, () -> {
            MDC.put(MDC_TRANSACTION_ID_KEY, String.valueOf(id));
            try {
                log.info("event=transaction_service.mutate.start action={} transactionId={} principal={}", action, id, principal);
                EscrowTransaction result = transactionTemplate.execute(status -> {
                    EscrowTransaction tx = load(id);
                    Instant now = clock.instant();
                    operation.accept(tx, now);
                    EscrowTransaction saved = transactionRepository.save(tx);
                    publish(saved, action, principal, now);
                    return saved;
                });
                if (result == null) {
                    throw new IllegalStateException("failed to apply " + action + " to transaction " + id);
                }
                log.info(
                        "event=transaction_service.mutate.done action={} transactionId={} status={} escrow={} store={}",
                        action,
                        id,
                        result.getStatus(),
                        result.getEscrow().getBalance(),
                        result.getStore().orElse("none")
                );
                return result;
            } catch (EscrowException e) {
                log.warn(
                        "event=transaction_service.mutate.rejected action={} transactionId={} principal={} code={} reason={}",
                        action,
                        id,
                        principal,
                        e.getCode(),
                        e.getMessage()
                );
                throw e;
            } finally {
                MDC.remove(MDC_TRANSACTION_ID_KEY);
            }
        });
    }

    // Statistics commit in their own transaction, so they wait until the release itself has committed.
    private void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private void applyFulfilment(EscrowTransaction tx, String principal, Instant now, EscrowErrorCode denialCode) {
        authorizationGuard.require(principal, Role.STORE_ONLY, tx, denialCode);
        deadlinePolicy.requireBefore(now, tx.getDeadline(), "fulfil");
        tx.markFulfilled(now);
    }

    // Ledger first: if the transfer fails the record is still untouched.
    private long releaseAll(EscrowTransaction tx, String beneficiary) {
        long amount = tx.getEscrow().getBalance();
        valueLedger.transfer(tx.getId(), beneficiary, amount);
        return tx.getEscrow().withdrawAll();
    }

    private void requireDetailUpdate(EscrowTransaction tx, String principal) {
        authorizationGuard.require(principal, Role.CUSTOMER_ONLY, tx, EscrowErrorCode.NOT_STORE);
        requireNoStore(tx, "update details");
    }

    // Fulfilment and open disputes lock the customer in; only release or resolution ends the episode then.
    private void requireNotLockedIn(EscrowTransaction tx, String action) {
        if (tx.isFulfilled() || tx.isDispute()) {
            throw new EscrowException(
                    EscrowErrorCode.INVALID_WITHDRAWAL,
                    action + " not allowed: fulfilled=" + tx.isFulfilled() + ", dispute=" + tx.isDispute()
            );
        }
    }

    private void requireNoStore(EscrowTransaction tx, String action) {
        tx.getStore().ifPresent(store -> {
            throw new EscrowException(
                    EscrowErrorCode.INVALID_TRANSACTION,
                    action + " requires no assigned store, but store=" + store
            );
        });
    }

    private String requireStore(EscrowTransaction tx, String action) {
        return tx.getStore().orElseThrow(() -> new EscrowException(
                EscrowErrorCode.INVALID_TRANSACTION,
                action + " requires an assigned store"
        ));
    }

    private EscrowTransaction load(UUID id) {
        return transactionRepository.findById(id)
                .orElseThrow(() -> new EscrowException(EscrowErrorCode.TRANSACTION_NOT_FOUND, "transaction not found: " + id));
    }

    private void publish(EscrowTransaction tx, String action, String principal, Instant now) {
        if (eventSink == null) {
            return;
        }
        eventSink.publish(new TransactionEvent(
                tx.getId(),
                action,
                principal,
                tx.getStatus(),
                tx.getEscrow().getBalance(),
                now
        ));
    }

    private static void requirePrincipal(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "principal is required");
        }
        if (principal.length() > EscrowTransaction.MAX_PRINCIPAL_LENGTH) {
            throw new EscrowException(
                    EscrowErrorCode.INVALID_REQUEST,
                    "principal must not exceed " + EscrowTransaction.MAX_PRINCIPAL_LENGTH + " characters"
            );
        }
    }

    private static void requireItem(String item) {
        if (item == null || item.isBlank()) {
            throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "item is required");
        }
        if (item.length() > EscrowTransaction.MAX_ITEM_LENGTH) {
            throw new EscrowException(
                    EscrowErrorCode.INVALID_REQUEST,
                    "item must not exceed " + EscrowTransaction.MAX_ITEM_LENGTH + " characters"
            );
        }
    }

    private static void requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, field + " must not be negative: " + value);
        }
    }
}
