package lab.escrow.common;

/**
 * Caller-correctable rejection of an escrow operation.
 * Raised before any state is changed, so the whole operation is rejected as a unit.
 */
public class EscrowException extends RuntimeException {

    private final EscrowErrorCode code;

    public EscrowException(EscrowErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EscrowErrorCode getCode() {
        return code;
    }
}
