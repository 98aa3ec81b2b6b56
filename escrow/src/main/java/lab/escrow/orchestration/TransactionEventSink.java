package lab.escrow.orchestration;

/**
 * Optional receiver of lifecycle events for external audit.
 * The engine behaves identically whether or not a sink is present.
 */
public interface TransactionEventSink {
    void publish(TransactionEvent event);
}
