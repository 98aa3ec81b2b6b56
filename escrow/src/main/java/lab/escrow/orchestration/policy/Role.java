package lab.escrow.orchestration.policy;

public enum Role {
    CUSTOMER_ONLY,
    STORE_ONLY,        // store must be assigned and equal to the caller
    CUSTOMER_OR_STORE
}
