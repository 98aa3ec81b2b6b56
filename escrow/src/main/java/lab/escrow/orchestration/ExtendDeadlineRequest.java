package lab.escrow.orchestration;

public record ExtendDeadlineRequest(long extensionMs) {}
