package lab.escrow.orchestration;

public record AmountRequest(long amount) {}
