package lab.escrow.orchestration;

public record ResolveDisputeRequest(boolean resolved) {}
