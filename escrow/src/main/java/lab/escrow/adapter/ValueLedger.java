package lab.escrow.adapter;

import java.util.UUID;

/**
 * Value-transfer primitive the escrow engine relies on.
 *
 * <p>Each call is atomic: it either moves the whole amount or fails without effect.
 * Custody accounts are addressed by the id of the transaction they belong to and live apart from
 * principal accounts, so no principal name can reach one.
 *
 * <p>When called inside a Spring-managed transaction, a movement is undone if that transaction
 * rolls back.
 */
public interface ValueLedger {

    /** Moves {@code amount} from the source principal's account into the transaction's custody account. */
    void depositIntoCustody(UUID custodyId, String sourcePrincipal, long amount);

    /** Moves {@code amount} out of the transaction's custody account to the target principal. */
    void transfer(UUID custodyId, String toPrincipal, long amount);

    long balanceOf(String principal);

    long custodyBalance(UUID custodyId);
}
