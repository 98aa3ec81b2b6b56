package lab.escrow.orchestration;

import lab.escrow.domain.transaction.TransactionStatus;

import java.time.Instant;

// Each update endpoint reads only its own field.
public record UpdateTransactionRequest(
        String item,
        Long price,
        Long quantity,
        Instant deadline,
        TransactionStatus status
) {}
