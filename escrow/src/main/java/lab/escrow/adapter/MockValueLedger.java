package lab.escrow.adapter;

import lab.escrow.common.EscrowErrorCode;
import lab.escrow.common.EscrowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory ledger for local runs and tests.
 * Principal accounts are opened on first use with a configurable starting balance.
 * Custody accounts are keyed by transaction id in a separate map and start empty.
 */
@Component
@Slf4j
public class MockValueLedger implements ValueLedger {

    private final long initialBalance;
    private final Map<String, Long> principalAccounts = new HashMap<>();
    private final Map<UUID, Long> custodyAccounts = new HashMap<>();

    public MockValueLedger(@Value("${escrow.ledger.initial-balance:1000000}") long initialBalance) {
        this.initialBalance = initialBalance;
    }

    @Override
    public synchronized void depositIntoCustody(UUID custodyId, String sourcePrincipal, long amount) {
        requirePositive(amount);
        long available = principalBalance(sourcePrincipal);
        if (available < amount) {
            throw new EscrowException(
                    EscrowErrorCode.INSUFFICIENT_FUNDS,
                    "insufficient funds: principal=" + sourcePrincipal + ", available=" + available + ", requested=" + amount
            );
        }
        moveIntoCustody(custodyId, sourcePrincipal, amount);
        log.info("event=ledger.deposit custodyId={} source={} amount={}", custodyId, sourcePrincipal, amount);
        undoOnRollback(() -> moveOutOfCustody(custodyId, sourcePrincipal, amount), "deposit", custodyId, amount);
    }

    @Override
    public synchronized void transfer(UUID custodyId, String toPrincipal, long amount) {
        if (amount < 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "transfer amount must not be negative: " + amount);
        }
        if (amount == 0) {
            return;
        }
        long held = custodyAccounts.getOrDefault(custodyId, 0L);
        if (held < amount) {
            throw new EscrowException(
                    EscrowErrorCode.INSUFFICIENT_ESCROW,
                    "custody account cannot cover transfer: custodyId=" + custodyId + ", held=" + held + ", requested=" + amount
            );
        }
        moveOutOfCustody(custodyId, toPrincipal, amount);
        log.info("event=ledger.transfer custodyId={} to={} amount={}", custodyId, toPrincipal, amount);
        undoOnRollback(() -> moveIntoCustody(custodyId, toPrincipal, amount), "transfer", custodyId, amount);
    }

    @Override
    public synchronized long balanceOf(String principal) {
        return principalBalance(principal);
    }

    @Override
    public synchronized long custodyBalance(UUID custodyId) {
        return custodyAccounts.getOrDefault(custodyId, 0L);
    }

    private void moveIntoCustody(UUID custodyId, String principal, long amount) {
        principalAccounts.put(principal, principalBalance(principal) - amount);
        custodyAccounts.merge(custodyId, amount, Long::sum);
    }

    private void moveOutOfCustody(UUID custodyId, String principal, long amount) {
        custodyAccounts.merge(custodyId, -amount, Long::sum);
        principalAccounts.put(principal, principalBalance(principal) + amount);
    }

    // The ledger joins the caller's database transaction: a rollback there reverses this movement.
    private void undoOnRollback(Runnable undo, String movement, UUID custodyId, long amount) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_ROLLED_BACK) {
                    return;
                }
                synchronized (MockValueLedger.this) {
                    undo.run();
                }
                log.warn("event=ledger.rollback movement={} custodyId={} amount={}", movement, custodyId, amount);
            }
        });
    }

    private long principalBalance(String principal) {
        return principalAccounts.computeIfAbsent(principal, key -> initialBalance);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, "amount must be positive: " + amount);
        }
    }
}
