package lab.escrow.orchestration;

import lab.escrow.common.EscrowErrorCode;
import lab.escrow.common.EscrowException;
import lab.escrow.domain.audit.TransactionAuditLog;
import lab.escrow.domain.transaction.EscrowTransaction;
import lab.escrow.domain.transaction.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/transactions")
@Slf4j
public class TransactionController {

    private static final String PRINCIPAL_HEADER = "X-Principal";

    private final TransactionService transactionService;
    private final AuditLogEventSink auditLogEventSink;

    // The caller opening the transaction becomes its customer.
    @PostMapping
    public ResponseEntity<TransactionDetails> create(
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody CreateTransactionRequest req
    ) {
        log.info(
                "event=transaction.create.request item={} quantity={} price={} durationMs={}",
                req.item(),
                req.quantity(),
                req.price(),
                req.durationMs()
        );
        EscrowTransaction tx = transactionService.createTransaction(
                principal,
                req.item(),
                req.quantity(),
                req.price(),
                Duration.ofMillis(req.durationMs())
        );
        log.info("event=transaction.create.response transactionId={} status={}", tx.getId(), tx.getStatus());
        return ResponseEntity.ok(TransactionDetails.from(tx));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionDetails> get(@PathVariable UUID id) {
        return ResponseEntity.ok(transactionService.getDetails(id));
    }

    @GetMapping("/{id}/item")
    public ResponseEntity<Map<String, String>> item(@PathVariable UUID id) {
        return ResponseEntity.ok(Map.of("item", transactionService.getItem(id)));
    }

    @GetMapping("/{id}/price")
    public ResponseEntity<Map<String, Long>> price(@PathVariable UUID id) {
        return ResponseEntity.ok(Map.of("price", transactionService.getPrice(id)));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<Map<String, TransactionStatus>> status(@PathVariable UUID id) {
        return ResponseEntity.ok(Map.of("status", transactionService.getStatus(id)));
    }

    @GetMapping("/{id}/deadline")
    public ResponseEntity<Map<String, Instant>> deadline(@PathVariable UUID id) {
        return ResponseEntity.ok(Map.of("deadline", transactionService.getDeadline(id)));
    }

    // Audit trail of every accepted mutation, oldest first.
    @GetMapping("/{id}/audit")
    public ResponseEntity<List<TransactionAuditLog>> audit(@PathVariable UUID id) {
        transactionService.get(id);
        List<TransactionAuditLog> history = auditLogEventSink.history(id);
        log.info("event=transaction.audit.response transactionId={} count={}", id, history.size());
        return ResponseEntity.ok(history);
    }

    @GetMapping
    public ResponseEntity<List<TransactionDetails>> list(
            @RequestParam(required = false) String customer,
            @RequestParam(required = false) String store
    ) {
        List<EscrowTransaction> found;
        if (customer != null) {
            found = transactionService.listByCustomer(customer);
        } else if (store != null) {
            found = transactionService.listByStore(store);
        } else {
            throw new IllegalArgumentException("either customer or store query parameter is required");
        }
        return ResponseEntity.ok(found.stream().map(TransactionDetails::from).toList());
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<TransactionDetails> accept(@PathVariable UUID id, @RequestHeader(PRINCIPAL_HEADER) String principal) {
        return respond(transactionService.acceptTransaction(id, principal));
    }

    @PostMapping("/{id}/fulfill")
    public ResponseEntity<TransactionDetails> fulfill(@PathVariable UUID id, @RequestHeader(PRINCIPAL_HEADER) String principal) {
        return respond(transactionService.fulfillTransaction(id, principal));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<TransactionDetails> complete(@PathVariable UUID id, @RequestHeader(PRINCIPAL_HEADER) String principal) {
        return respond(transactionService.markComplete(id, principal));
    }

    @PostMapping("/{id}/dispute")
    public ResponseEntity<TransactionDetails> dispute(@PathVariable UUID id, @RequestHeader(PRINCIPAL_HEADER) String principal) {
        return respond(transactionService.disputeTransaction(id, principal));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<TransactionDetails> resolve(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody ResolveDisputeRequest req
    ) {
        return respond(transactionService.resolveDispute(id, principal, req.resolved()));
    }

    @PostMapping("/{id}/release")
    public ResponseEntity<TransactionDetails> release(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody ReleasePaymentRequest req
    ) {
        return respond(transactionService.releasePayment(id, principal, req.review(), req.rating()));
    }

    @PostMapping("/{id}/funds")
    public ResponseEntity<TransactionDetails> addFunds(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody AmountRequest req
    ) {
        return respond(transactionService.addFunds(id, principal, req.amount()));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TransactionDetails> cancel(@PathVariable UUID id, @RequestHeader(PRINCIPAL_HEADER) String principal) {
        return respond(transactionService.cancelTransaction(id, principal));
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<TransactionDetails> refund(@PathVariable UUID id, @RequestHeader(PRINCIPAL_HEADER) String principal) {
        return respond(transactionService.requestRefund(id, principal));
    }

    @PostMapping("/{id}/partial-refund")
    public ResponseEntity<TransactionDetails> partialRefund(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody AmountRequest req
    ) {
        return respond(transactionService.partialRefund(id, principal, req.amount()));
    }

    @PostMapping("/{id}/rating")
    public ResponseEntity<TransactionDetails> rate(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody RatingRequest req
    ) {
        return respond(transactionService.rateStore(id, principal, req.rating()));
    }

    @PostMapping("/{id}/deadline/extend")
    public ResponseEntity<TransactionDetails> extendDeadline(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody ExtendDeadlineRequest req
    ) {
        return respond(transactionService.extendDeadline(id, principal, Duration.ofMillis(req.extensionMs())));
    }

    @PutMapping("/{id}/item")
    public ResponseEntity<TransactionDetails> updateItem(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody UpdateTransactionRequest req
    ) {
        return respond(transactionService.updateItem(id, principal, req.item()));
    }

    @PutMapping("/{id}/price")
    public ResponseEntity<TransactionDetails> updatePrice(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody UpdateTransactionRequest req
    ) {
        return respond(transactionService.updatePrice(id, principal, requireField("price", req.price())));
    }

    @PutMapping("/{id}/quantity")
    public ResponseEntity<TransactionDetails> updateQuantity(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody UpdateTransactionRequest req
    ) {
        return respond(transactionService.updateQuantity(id, principal, requireField("quantity", req.quantity())));
    }

    @PutMapping("/{id}/deadline")
    public ResponseEntity<TransactionDetails> updateDeadline(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody UpdateTransactionRequest req
    ) {
        return respond(transactionService.updateDeadline(id, principal, req.deadline()));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<TransactionDetails> updateStatus(
            @PathVariable UUID id,
            @RequestHeader(PRINCIPAL_HEADER) String principal,
            @RequestBody UpdateTransactionRequest req
    ) {
        return respond(transactionService.updateStatus(id, principal, req.status()));
    }

    private ResponseEntity<TransactionDetails> respond(EscrowTransaction tx) {
        log.info(
                "event=transaction.mutation.response transactionId={} status={} escrow={}",
                tx.getId(),
                tx.getStatus(),
                tx.getEscrow().getBalance()
        );
        return ResponseEntity.ok(TransactionDetails.from(tx));
    }

    private static long requireField(String field, Long value) {
        if (value == null) {
            throw new EscrowException(EscrowErrorCode.INVALID_REQUEST, field + " is required");
        }
        return value;
    }
}
