package lab.escrow.orchestration;

import lab.escrow.domain.audit.TransactionAuditLog;
import lab.escrow.domain.audit.TransactionAuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditLogEventSink implements TransactionEventSink {

    private final TransactionAuditLogRepository auditLogRepository;

    @Override
    public void publish(TransactionEvent event) {
        auditLogRepository.save(TransactionAuditLog.of(
                event.transactionId(),
                event.action(),
                event.principal(),
                event.status(),
                event.escrowBalance(),
                event.timestamp()
        ));
        log.debug("event=audit_log.saved transactionId={} action={}", event.transactionId(), event.action());
    }

    @Transactional(readOnly = true)
    public List<TransactionAuditLog> history(UUID transactionId) {
        return auditLogRepository.findByTransactionIdOrderByCreatedAtAsc(transactionId);
    }
}
