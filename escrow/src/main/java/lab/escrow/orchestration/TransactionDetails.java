package lab.escrow.orchestration;

import lab.escrow.domain.transaction.EscrowTransaction;
import lab.escrow.domain.transaction.TransactionStatus;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public record TransactionDetails(
        UUID id,
        String customer,
        Optional<String> store,
        String item,
        long quantity,
        long price,
        long escrow,
        boolean dispute,
        boolean fulfilled,
        Optional<Integer> rating,
        TransactionStatus status,
        int episode,
        Instant createdAt,
        Instant deadline
) {
    public static TransactionDetails from(EscrowTransaction tx) {
        return new TransactionDetails(
                tx.getId(),
                tx.getCustomer(),
                tx.getStore(),
                tx.getItem(),
                tx.getQuantity(),
                tx.getPrice(),
                tx.getEscrow().getBalance(),
                tx.isDispute(),
                tx.isFulfilled(),
                tx.getRating(),
                tx.getStatus(),
                tx.getEpisode(),
                tx.getCreatedAt(),
                tx.getDeadline()
        );
    }
}
