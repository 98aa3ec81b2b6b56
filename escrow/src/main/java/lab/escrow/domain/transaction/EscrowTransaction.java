package lab.escrow.domain.transaction;

import jakarta.persistence.*;
import lab.escrow.domain.custody.EscrowCustody;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "escrow_transactions",
       indexes = {
           @Index(name = "idx_escrow_tx_customer", columnList = "customer"),
           @Index(name = "idx_escrow_tx_store", columnList = "store")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class EscrowTransaction {

    public static final int MAX_PRINCIPAL_LENGTH = 128;
    public static final int MAX_ITEM_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = MAX_PRINCIPAL_LENGTH)
    private String customer;

    // absent until accepted, cleared on every episode reset
    @Getter(AccessLevel.NONE)
    @Column(length = MAX_PRINCIPAL_LENGTH)
    private String store;

    @Column(nullable = false, length = MAX_ITEM_LENGTH)
    private String item;

    @Column(nullable = false)
    private long quantity;

    @Column(nullable = false)
    private long price; // same unit as escrow

    @Embedded
    private EscrowCustody escrow;

    @Column(nullable = false)
    private boolean dispute;

    @Column(nullable = false)
    private boolean fulfilled;

    @Getter(AccessLevel.NONE)
    private Integer rating;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TransactionStatus status;

    @Column(nullable = false)
    private int episode;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant deadline;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private long version;

    public static EscrowTransaction open(
            String customer,
            String item,
            long quantity,
            long price,
            Duration duration,
            Instant now) {
        return EscrowTransaction.builder()
                .customer(customer)
                .item(item)
                .quantity(quantity)
                .price(price)
                .escrow(EscrowCustody.empty())
                .status(TransactionStatus.OPEN)
                .episode(1)
                .createdAt(now)
                .deadline(now.plus(duration))
                .updatedAt(now)
                .build();
    }

    public Optional<String> getStore() {
        return Optional.ofNullable(store);
    }

    public Optional<Integer> getRating() {
        return Optional.ofNullable(rating);
    }

    public boolean isCustomer(String principal) {
        return principal != null && principal.equals(customer);
    }

    public boolean isAssignedStore(String principal) {
        return principal != null && principal.equals(store);
    }

    public void accept(String acceptingStore, Instant now) {
        if (store != null) {
            throw new IllegalStateException("transaction already accepted by " + store);
        }
        if (status.endsEpisode()) {
            this.episode++;
            this.rating = null;
        }
        this.store = acceptingStore;
        transitionTo(TransactionStatus.ACCEPTED, now);
    }

    public void markFulfilled(Instant now) {
        if (store == null) {
            throw new IllegalStateException("cannot fulfil a transaction without an assigned store");
        }
        this.fulfilled = true;
        if (!dispute) {
            transitionTo(TransactionStatus.FULFILLED, now);
        } else {
            this.updatedAt = now;
        }
    }

    public void openDispute(Instant now) {
        this.dispute = true;
        transitionTo(TransactionStatus.DISPUTED, now);
    }

    // Ends the current episode: store, fulfilment and dispute go back to their initial values.
    public void resetEpisode(TransactionStatus terminal, Instant now) {
        if (!terminal.endsEpisode()) {
            throw new IllegalArgumentException("not an episode-ending status: " + terminal);
        }
        this.store = null;
        this.fulfilled = false;
        this.dispute = false;
        transitionTo(terminal, now);
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }

    public void rate(int value, Instant now) {
        this.rating = value;
        this.updatedAt = now;
    }

    public void changeItem(String newItem, Instant now) {
        this.item = newItem;
        this.updatedAt = now;
    }

    public void changePrice(long newPrice, Instant now) {
        this.price = newPrice;
        this.updatedAt = now;
    }

    public void changeQuantity(long newQuantity, Instant now) {
        this.quantity = newQuantity;
        this.updatedAt = now;
    }

    public void changeDeadline(Instant newDeadline, Instant now) {
        this.deadline = newDeadline;
        this.updatedAt = now;
    }

    public void extendDeadline(Duration extension, Instant now) {
        this.deadline = deadline.plus(extension);
        this.updatedAt = now;
    }

    public void transitionTo(TransactionStatus next, Instant now) {
        if (next.requiresStore() && store == null) {
            throw new IllegalStateException("invalid transaction status without store: " + status + " -> " + next);
        }
        this.status = next;
        this.updatedAt = now;
    }
}
