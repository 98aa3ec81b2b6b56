package lab.escrow.adapter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/ledger")
@Slf4j
public class LedgerController {

    private final ValueLedger valueLedger;

    // Read-only view so callers can confirm where released value ended up.
    @GetMapping("/accounts/{principal}")
    public ResponseEntity<AccountBalance> balance(@PathVariable String principal) {
        long balance = valueLedger.balanceOf(principal);
        log.info("event=ledger.balance.response principal={} balance={}", principal, balance);
        return ResponseEntity.ok(new AccountBalance(principal, balance));
    }

    public record AccountBalance(String principal, long balance) {}
}
