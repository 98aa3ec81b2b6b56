package lab.escrow.orchestration;

import lab.escrow.common.EscrowException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiExceptionHandler {

    @ExceptionHandler(EscrowException.class)
    public ResponseEntity<Map<String, String>> handleEscrowException(EscrowException e) {
        return ResponseEntity
                .status(e.getCode().httpStatus())
                .body(Map.of(
                        "code", e.getCode().name(),
                        "message", e.getMessage()
                ));
    }
}
