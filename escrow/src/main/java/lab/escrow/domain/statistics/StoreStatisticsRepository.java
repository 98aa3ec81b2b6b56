package lab.escrow.domain.statistics;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface StoreStatisticsRepository extends JpaRepository<StoreStatistics, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from StoreStatistics s where s.store = :store")
    Optional<StoreStatistics> findByStoreForUpdate(@Param("store") String store);
}
