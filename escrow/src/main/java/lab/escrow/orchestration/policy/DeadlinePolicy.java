package lab.escrow.orchestration.policy;

import lab.escrow.common.EscrowErrorCode;
import lab.escrow.common.EscrowException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Fulfilment must land strictly before the deadline; payment release only strictly after it.
 * The deadline instant itself satisfies neither.
 */
@Component
public class DeadlinePolicy {

    public boolean before(Instant now, Instant deadline) {
        return now.isBefore(deadline);
    }

    public boolean after(Instant now, Instant deadline) {
        return now.isAfter(deadline);
    }

    public void requireBefore(Instant now, Instant deadline, String action) {
        if (!before(now, deadline)) {
            throw new EscrowException(
                    EscrowErrorCode.DEADLINE_PASSED,
                    action + " requires now < deadline: now=" + now + ", deadline=" + deadline
            );
        }
    }

    public void requireAfter(Instant now, Instant deadline, String action) {
        if (!after(now, deadline)) {
            throw new EscrowException(
                    EscrowErrorCode.DEADLINE_PASSED,
                    action + " requires now > deadline: now=" + now + ", deadline=" + deadline
            );
        }
    }
}
