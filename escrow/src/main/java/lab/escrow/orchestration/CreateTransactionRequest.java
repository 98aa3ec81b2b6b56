package lab.escrow.orchestration;

public record CreateTransactionRequest(
        String item,
        long quantity,
        long price,
        long durationMs
) {}
