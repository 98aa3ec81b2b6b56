package lab.escrow.domain.review;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "item_reviews", indexes = {
        @Index(name = "idx_review_store", columnList = "store"),
        @Index(name = "idx_review_customer", columnList = "customer"),
        @Index(name = "idx_review_transaction", columnList = "transactionId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class ItemReview {

    public static final int MAX_REVIEW_TEXT_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID transactionId;

    @Column(nullable = false, updatable = false, length = 128)
    private String customer;

    @Column(nullable = false, updatable = false, length = 128)
    private String store;

    @Column(nullable = false, updatable = false, length = MAX_REVIEW_TEXT_LENGTH)
    private String reviewText;

    @Column(nullable = false, updatable = false)
    private int rating;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static ItemReview of(UUID transactionId, String customer, String store, String reviewText, int rating, Instant now) {
        return ItemReview.builder()
                .transactionId(transactionId)
                .customer(customer)
                .store(store)
                .reviewText(reviewText == null ? "" : reviewText)
                .rating(rating)
                .createdAt(now)
                .build();
    }
}
