package lab.escrow.domain.custody;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lab.escrow.common.EscrowErrorCode;
import lab.escrow.common.EscrowException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Value held in custody for a single transaction.
 *
 * <p>The balance never goes negative and always equals {@code totalDeposited - totalWithdrawn}.
 * Both rules are enforced here rather than trusted to callers.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EscrowCustody {

    @Column(name = "escrow_balance", nullable = false)
    private long balance;

    @Column(name = "escrow_total_deposited", nullable = false)
    private long totalDeposited;

    @Column(name = "escrow_total_withdrawn", nullable = false)
    private long totalWithdrawn;

    public static EscrowCustody empty() {
        return new EscrowCustody();
    }

    public void deposit(long amount) {
        requireNonNegative(amount);
        this.balance = Math.addExact(balance, amount);
        this.totalDeposited = Math.addExact(totalDeposited, amount);
    }

    public long withdrawAll() {
        long released = balance;
        this.balance = 0;
        this.totalWithdrawn = Math.addExact(totalWithdrawn, released);
        return released;
    }

    public long withdraw(long amount) {
        requireNonNegative(amount);
        if (amount > balance) {
            throw new EscrowException(
                    EscrowErrorCode.INSUFFICIENT_ESCROW,
                    "withdrawal exceeds escrow: requested=" + amount + ", balance=" + balance
            );
        }
        this.balance -= amount;
        this.totalWithdrawn = Math.addExact(totalWithdrawn, amount);
        return amount;
    }

    public boolean isEmpty() {
        return balance == 0;
    }

    public boolean isConserved() {
        return balance >= 0 && totalDeposited - totalWithdrawn == balance;
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "amount must not be negative: " + amount);
        }
    }
}
