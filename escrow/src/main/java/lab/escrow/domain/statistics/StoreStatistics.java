package lab.escrow.domain.statistics;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Running totals for one store, keyed by the store principal.
 * Only successful payment releases feed these numbers.
 */
@Entity
@Table(name = "store_statistics")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class StoreStatistics {

    @Id
    @Column(length = 128)
    private String store;

    @Column(nullable = false)
    private long totalTransactions;

    @Column(nullable = false)
    private long totalRevenue;

    @Column(nullable = false)
    private double averageRating;

    @Column(nullable = false)
    private Instant updatedAt;

    public static StoreStatistics empty(String store, Instant now) {
        return StoreStatistics.builder()
                .store(store)
                .totalTransactions(0)
                .totalRevenue(0)
                .averageRating(0.0)
                .updatedAt(now)
                .build();
    }

    public void recordSale(long revenue, int rating, Instant now) {
        long n = totalTransactions + 1;
        this.averageRating = (averageRating * (n - 1) + rating) / n;
        this.totalRevenue = Math.addExact(totalRevenue, revenue);
        this.totalTransactions = n;
        this.updatedAt = now;
    }
}
