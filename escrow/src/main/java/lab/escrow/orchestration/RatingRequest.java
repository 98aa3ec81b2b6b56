package lab.escrow.orchestration;

public record RatingRequest(Integer rating) {}
