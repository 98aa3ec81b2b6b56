package lab.escrow.orchestration;

import lab.escrow.domain.transaction.TransactionStatus;

import java.time.Instant;
import java.util.UUID;

public record TransactionEvent(
        UUID transactionId,
        String action,
        String principal,
        TransactionStatus status,
        long escrowBalance,
        Instant timestamp
) {}
