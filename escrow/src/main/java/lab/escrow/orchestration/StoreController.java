package lab.escrow.orchestration;

import lab.escrow.domain.review.ItemReview;
import lab.escrow.domain.statistics.StoreStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Slf4j
public class StoreController {

    private final StoreStatisticsService storeStatisticsService;
    private final ReviewService reviewService;

    // 404 until the store's first released payment creates the record.
    @GetMapping("/stores/{store}/statistics")
    public ResponseEntity<StoreStatistics> statistics(@PathVariable String store) {
        log.info("event=store.statistics.request store={}", store);
        return storeStatisticsService.find(store)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/stores/{store}/reviews")
    public ResponseEntity<List<ItemReview>> storeReviews(@PathVariable String store) {
        List<ItemReview> reviews = reviewService.listForStore(store);
        log.info("event=store.reviews.response store={} count={}", store, reviews.size());
        return ResponseEntity.ok(reviews);
    }

    @GetMapping("/customers/{customer}/reviews")
    public ResponseEntity<List<ItemReview>> customerReviews(@PathVariable String customer) {
        List<ItemReview> reviews = reviewService.listByCustomer(customer);
        log.info("event=customer.reviews.response customer={} count={}", customer, reviews.size());
        return ResponseEntity.ok(reviews);
    }
}
