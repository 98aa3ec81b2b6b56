package lab.escrow.domain.transaction;

public enum TransactionStatus {
    OPEN,
    ACCEPTED,
    FULFILLED,
    DISPUTED,
    RESOLVED,   // episode ends, record may be accepted again
    COMPLETED,  // episode ends
    CANCELLED,  // episode ends
    REFUNDED;   // episode ends

    public boolean endsEpisode() {
        return this == RESOLVED || this == COMPLETED || this == CANCELLED || this == REFUNDED;
    }

    // Labels that only make sense while a store is assigned.
    public boolean requiresStore() {
        return this == ACCEPTED || this == FULFILLED || this == DISPUTED;
    }
}
