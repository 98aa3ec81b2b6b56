package lab.escrow.domain.review;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ItemReviewRepository extends JpaRepository<ItemReview, UUID> {

    List<ItemReview> findByStoreOrderByCreatedAtAsc(String store);

    List<ItemReview> findByCustomerOrderByCreatedAtAsc(String customer);

    List<ItemReview> findByTransactionIdOrderByCreatedAtAsc(UUID transactionId);
}
