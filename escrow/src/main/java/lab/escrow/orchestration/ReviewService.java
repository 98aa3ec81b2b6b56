package lab.escrow.orchestration;

import lab.escrow.domain.review.ItemReview;
import lab.escrow.domain.review.ItemReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewService {

    private final ItemReviewRepository itemReviewRepository;

    // Reviews are written once per released payment and never edited afterwards.
    @Transactional
    public ItemReview recordReview(UUID transactionId, String customer, String store, String reviewText, int rating, Instant now) {
        ItemReview saved = itemReviewRepository.save(ItemReview.of(transactionId, customer, store, reviewText, rating, now));
        log.info(
                "event=review_service.recorded transactionId={} reviewId={} store={} rating={}",
                transactionId,
                saved.getId(),
                store,
                rating
        );
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ItemReview> listForStore(String store) {
        return itemReviewRepository.findByStoreOrderByCreatedAtAsc(store);
    }

    @Transactional(readOnly = true)
    public List<ItemReview> listByCustomer(String customer) {
        return itemReviewRepository.findByCustomerOrderByCreatedAtAsc(customer);
    }
}
