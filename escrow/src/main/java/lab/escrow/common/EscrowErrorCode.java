package lab.escrow.common;

import org.springframework.http.HttpStatus;

public enum EscrowErrorCode {
    INVALID_TRANSACTION(HttpStatus.CONFLICT),
    INVALID_ITEM(HttpStatus.FORBIDDEN),
    DISPUTE(HttpStatus.FORBIDDEN),
    ALREADY_RESOLVED(HttpStatus.CONFLICT),
    NOT_STORE(HttpStatus.FORBIDDEN),
    INVALID_WITHDRAWAL(HttpStatus.CONFLICT),
    DEADLINE_PASSED(HttpStatus.CONFLICT),
    INSUFFICIENT_ESCROW(HttpStatus.CONFLICT),
    INVALID_RATING(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_FUNDS(HttpStatus.CONFLICT),
    TRANSACTION_NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    EscrowErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
