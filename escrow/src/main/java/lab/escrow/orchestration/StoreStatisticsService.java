package lab.escrow.orchestration;

import lab.escrow.common.KeyedLocks;
import lab.escrow.domain.statistics.StoreStatistics;
import lab.escrow.domain.statistics.StoreStatisticsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;

@Service
@Slf4j
public class StoreStatisticsService {

    private final StoreStatisticsRepository storeStatisticsRepository;
    private final TransactionTemplate requiresNewTemplate;
    private final KeyedLocks<String> storeLocks = new KeyedLocks<>();

    public StoreStatisticsService(StoreStatisticsRepository storeStatisticsRepository, PlatformTransactionManager transactionManager) {
        this.storeStatisticsRepository = storeStatisticsRepository;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // Releases for different transactions of the same store race on one record.
    // The per-store lock is held until the read-modify-write has committed.
    public StoreStatistics recordSale(String store, long revenue, int rating, Instant now) {
        return storeLocks.withLock(store, () -> {
            StoreStatistics saved = requiresNewTemplate.execute(status -> {
                StoreStatistics statistics = storeStatisticsRepository.findByStoreForUpdate(store)
                        .orElseGet(() -> {
                            log.info("event=store_statistics.created store={}", store);
                            return StoreStatistics.empty(store, now);
                        });
                statistics.recordSale(revenue, rating, now);
                return storeStatisticsRepository.save(statistics);
            });
            if (saved == null) {
                throw new IllegalStateException("failed to update statistics for store " + store);
            }
            log.info(
                    "event=store_statistics.updated store={} totalTransactions={} totalRevenue={} averageRating={}",
                    store,
                    saved.getTotalTransactions(),
                    saved.getTotalRevenue(),
                    saved.getAverageRating()
            );
            return saved;
        });
    }

    @Transactional(readOnly = true)
    public Optional<StoreStatistics> find(String store) {
        return storeStatisticsRepository.findById(store);
    }
}
