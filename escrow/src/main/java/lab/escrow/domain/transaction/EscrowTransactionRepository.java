package lab.escrow.domain.transaction;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface EscrowTransactionRepository extends JpaRepository<EscrowTransaction, UUID> {

    List<EscrowTransaction> findByCustomerOrderByCreatedAtAsc(String customer);

    List<EscrowTransaction> findByStoreOrderByCreatedAtAsc(String store);
}
