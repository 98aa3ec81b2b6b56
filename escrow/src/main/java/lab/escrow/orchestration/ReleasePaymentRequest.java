package lab.escrow.orchestration;

public record ReleasePaymentRequest(
        String review,
        Integer rating
) {}
