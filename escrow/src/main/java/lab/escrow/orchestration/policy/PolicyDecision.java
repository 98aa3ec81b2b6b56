package lab.escrow.orchestration.policy;

import lab.escrow.common.EscrowErrorCode;
import lab.escrow.common.EscrowException;

/**
 * Outcome of a policy check. The denial code is supplied by whoever enforces the decision,
 * since the same check backs operations that report different codes.
 */
public record PolicyDecision(
        boolean allowed,
        String reason
) {
    private static final PolicyDecision ALLOWED = new PolicyDecision(true, "ALLOWED");

    public static PolicyDecision allow() {
        return ALLOWED;
    }

    public static PolicyDecision reject(String reason) {
        return new PolicyDecision(false, reason);
    }

    public void enforce(EscrowErrorCode denialCode) {
        if (!allowed) {
            throw new EscrowException(denialCode, reason);
        }
    }
}
