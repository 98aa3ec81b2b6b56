package lab.escrow.orchestration.policy;

import lab.escrow.common.EscrowErrorCode;
import lab.escrow.domain.transaction.EscrowTransaction;
import org.springframework.stereotype.Component;

/**
 * Decides whether a caller holds the role an operation needs on a given transaction.
 *
 * <p>The check is the same for every operation; the error code is chosen by the call site
 * so each operation reports its own reason.
 */
@Component
public class AuthorizationGuard {

    public PolicyDecision check(String principal, Role role, EscrowTransaction transaction) {
        if (principal == null || principal.isBlank()) {
            return PolicyDecision.reject("PRINCIPAL_MISSING");
        }

        boolean customer = transaction.isCustomer(principal);
        boolean store = transaction.isAssignedStore(principal);

        return switch (role) {
            case CUSTOMER_ONLY -> customer
                    ? PolicyDecision.allow()
                    : PolicyDecision.reject("NOT_CUSTOMER: principal=" + principal);
            case STORE_ONLY -> store
                    ? PolicyDecision.allow()
                    : PolicyDecision.reject("NOT_ASSIGNED_STORE: principal=" + principal);
            case CUSTOMER_OR_STORE -> customer || store
                    ? PolicyDecision.allow()
                    : PolicyDecision.reject("NOT_COUNTERPARTY: principal=" + principal);
        };
    }

    public void require(String principal, Role role, EscrowTransaction transaction, EscrowErrorCode denialCode) {
        check(principal, role, transaction).enforce(denialCode);
    }
}
