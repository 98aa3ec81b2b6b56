package lab.escrow.orchestration.policy;

import lab.escrow.common.EscrowErrorCode;
import lab.escrow.common.EscrowException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class RatingPolicy {

    private final int minRating;
    private final int maxRating;

    public RatingPolicy(
            @Value("${escrow.rating.min:1}") int minRating,
            @Value("${escrow.rating.max:5}") int maxRating
    ) {
        if (minRating > maxRating) {
            throw new IllegalStateException("escrow.rating.min must not exceed escrow.rating.max");
        }
        this.minRating = minRating;
        this.maxRating = maxRating;
    }

    public boolean isValid(Integer rating) {
        return rating != null && rating >= minRating && rating <= maxRating;
    }

    public int require(Integer rating) {
        if (!isValid(rating)) {
            throw new EscrowException(
                    EscrowErrorCode.INVALID_RATING,
                    "rating must be between " + minRating + " and " + maxRating + ": " + rating
            );
        }
        return rating;
    }
}
