package lab.escrow.domain.audit;

import jakarta.persistence.*;
import lab.escrow.domain.transaction.TransactionStatus;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transaction_audit_logs", indexes = {
        @Index(name = "idx_tx_audit_transaction", columnList = "transactionId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class TransactionAuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID transactionId;

    @Column(nullable = false, updatable = false, length = 64)
    private String action;

    @Column(nullable = false, updatable = false, length = 128)
    private String principal;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private TransactionStatus status;

    @Column(nullable = false, updatable = false)
    private long escrowBalance;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static TransactionAuditLog of(
            UUID transactionId,
            String action,
            String principal,
            TransactionStatus status,
            long escrowBalance,
            Instant createdAt) {
        return TransactionAuditLog.builder()
                .transactionId(transactionId)
                .action(action)
                .principal(principal)
                .status(status)
                .escrowBalance(escrowBalance)
                .createdAt(createdAt)
                .build();
    }
}
