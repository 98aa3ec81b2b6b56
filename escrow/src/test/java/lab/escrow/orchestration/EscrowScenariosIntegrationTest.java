package lab.escrow.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import lab.escrow.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(EscrowScenariosIntegrationTest.FixedClockConfig.class)
class EscrowScenariosIntegrationTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");
    private static final String PRINCIPAL = "X-Principal";
    private static final long STARTING_BALANCE = 1_000_000;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(T0);
    }

    @Test
    void scenario1_happyPath_releasesToStoreAndRecordsReviewStatisticsAndAudit() throws Exception {
        String id = create("cust-s1", 100, 1000);

        clock.advance(Duration.ofMillis(1));
        mockMvc.perform(post("/transactions/{id}/accept", id).header(PRINCIPAL, "store-s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACCEPTED"))
                .andExpect(jsonPath("$.store").value("store-s1"));

        clock.advance(Duration.ofMillis(1));
        mockMvc.perform(post("/transactions/{id}/funds", id)
                        .header(PRINCIPAL, "cust-s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.escrow").value(100));

        clock.advance(Duration.ofMillis(500));
        mockMvc.perform(post("/transactions/{id}/fulfill", id).header(PRINCIPAL, "store-s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FULFILLED"))
                .andExpect(jsonPath("$.fulfilled").value(true));

        clock.set(T0.plusMillis(1001));
        mockMvc.perform(post("/transactions/{id}/release", id)
                        .header(PRINCIPAL, "cust-s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "review": "arrived on time",
                                  "rating": 5
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.store").isEmpty())
                .andExpect(jsonPath("$.escrow").value(0))
                .andExpect(jsonPath("$.fulfilled").value(false))
                .andExpect(jsonPath("$.rating").value(5));

        mockMvc.perform(get("/stores/{store}/statistics", "store-s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTransactions").value(1))
                .andExpect(jsonPath("$.totalRevenue").value(100))
                .andExpect(jsonPath("$.averageRating").value(5.0));

        mockMvc.perform(get("/stores/{store}/reviews", "store-s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].reviewText").value("arrived on time"))
                .andExpect(jsonPath("$[0].rating").value(5))
                .andExpect(jsonPath("$[0].customer").value("cust-s1"));

        mockMvc.perform(get("/ledger/accounts/{principal}", "store-s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(STARTING_BALANCE + 100));
        mockMvc.perform(get("/ledger/accounts/{principal}", "cust-s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(STARTING_BALANCE - 100));

        mockMvc.perform(get("/transactions/{id}/audit", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(5))
                .andExpect(jsonPath("$[0].action").value("CREATED"))
                .andExpect(jsonPath("$[1].action").value("ACCEPTED"))
                .andExpect(jsonPath("$[2].action").value("FUNDS_ADDED"))
                .andExpect(jsonPath("$[4].action").value("PAYMENT_RELEASED"))
                .andExpect(jsonPath("$[4].status").value("COMPLETED"));
    }

    @Test
    void scenario2_disputeResolvedForCustomer_refundsAndResets() throws Exception {
        String id = acceptedAndFunded("cust-s2", "store-s2", 100);

        mockMvc.perform(post("/transactions/{id}/dispute", id).header(PRINCIPAL, "cust-s2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DISPUTED"))
                .andExpect(jsonPath("$.dispute").value(true));

        mockMvc.perform(post("/transactions/{id}/resolve", id)
                        .header(PRINCIPAL, "cust-s2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolved\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.store").isEmpty())
                .andExpect(jsonPath("$.dispute").value(false))
                .andExpect(jsonPath("$.escrow").value(0));

        mockMvc.perform(get("/ledger/accounts/{principal}", "cust-s2"))
                .andExpect(jsonPath("$.balance").value(STARTING_BALANCE));

        mockMvc.perform(post("/transactions/{id}/resolve", id)
                        .header(PRINCIPAL, "cust-s2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolved\": true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_RESOLVED"));
    }

    @Test
    void scenario3_releaseBeforeDeadline_isRejectedWithDeadlinePassed() throws Exception {
        String id = create("cust-s3", 100, 1000);
        mockMvc.perform(post("/transactions/{id}/accept", id).header(PRINCIPAL, "store-s3"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/transactions/{id}/release", id)
                        .header(PRINCIPAL, "cust-s3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"review\": \"early\", \"rating\": 4}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DEADLINE_PASSED"));

        mockMvc.perform(get("/stores/{store}/statistics", "store-s3"))
                .andExpect(status().isNotFound());
    }

    @Test
    void scenario4_refundAfterFulfilment_isRejectedAndEscrowStays() throws Exception {
        String id = acceptedAndFunded("cust-s4", "store-s4", 100);
        mockMvc.perform(post("/transactions/{id}/fulfill", id).header(PRINCIPAL, "store-s4"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/transactions/{id}/refund", id).header(PRINCIPAL, "cust-s4"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_WITHDRAWAL"));

        mockMvc.perform(get("/transactions/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.escrow").value(100))
                .andExpect(jsonPath("$.status").value("FULFILLED"));
    }

    @Test
    void scenario5_cancelByUnrelatedPrincipal_isForbidden() throws Exception {
        String id = acceptedAndFunded("cust-s5", "store-s5", 100);

        mockMvc.perform(post("/transactions/{id}/cancel", id).header(PRINCIPAL, "someone-else"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_STORE"));

        mockMvc.perform(post("/transactions/{id}/cancel", id).header(PRINCIPAL, "store-s5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.store").isEmpty());

        mockMvc.perform(get("/ledger/accounts/{principal}", "cust-s5"))
                .andExpect(jsonPath("$.balance").value(STARTING_BALANCE));
    }

    @Test
    void scenario6_secondAcceptance_isRejected() throws Exception {
        String id = create("cust-s6", 100, 1000);
        mockMvc.perform(post("/transactions/{id}/accept", id).header(PRINCIPAL, "store-s6a"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/transactions/{id}/accept", id).header(PRINCIPAL, "store-s6b"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSACTION"));

        mockMvc.perform(get("/transactions").param("store", "store-s6a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(id));
        mockMvc.perform(get("/transactions").param("store", "store-s6b"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void detailUpdates_andFieldReaders_workBeforeAcceptance() throws Exception {
        String id = create("cust-upd", 100, 1000);

        mockMvc.perform(put("/transactions/{id}/item", id)
                        .header(PRINCIPAL, "cust-upd")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item\": \"lamp\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(put("/transactions/{id}/price", id)
                        .header(PRINCIPAL, "cust-upd")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": 250}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/transactions/{id}/item", id))
                .andExpect(jsonPath("$.item").value("lamp"));
        mockMvc.perform(get("/transactions/{id}/price", id))
                .andExpect(jsonPath("$.price").value(250));
        mockMvc.perform(get("/transactions/{id}/status", id))
                .andExpect(jsonPath("$.status").value("OPEN"));

        mockMvc.perform(post("/transactions/{id}/accept", id).header(PRINCIPAL, "store-upd"))
                .andExpect(status().isOk());
        mockMvc.perform(put("/transactions/{id}/price", id)
                        .header(PRINCIPAL, "cust-upd")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": 1}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSACTION"));
    }

    @Test
    void overlongReview_isBadRequestAndLeavesRecordAndLedgerUntouched() throws Exception {
        String id = acceptedAndFunded("cust-long", "store-long", 100);
        mockMvc.perform(post("/transactions/{id}/fulfill", id).header(PRINCIPAL, "store-long"))
                .andExpect(status().isOk());
        clock.set(T0.plusMillis(1001));

        mockMvc.perform(post("/transactions/{id}/release", id)
                        .header(PRINCIPAL, "cust-long")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"review\": \"%s\", \"rating\": 5}".formatted("r".repeat(3000))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(get("/transactions/{id}", id))
                .andExpect(jsonPath("$.status").value("FULFILLED"))
                .andExpect(jsonPath("$.escrow").value(100))
                .andExpect(jsonPath("$.store").value("store-long"));
        mockMvc.perform(get("/ledger/accounts/{principal}", "store-long"))
                .andExpect(jsonPath("$.balance").value(STARTING_BALANCE));
        mockMvc.perform(get("/stores/{store}/statistics", "store-long"))
                .andExpect(status().isNotFound());
    }

    @Test
    void overlongItem_isBadRequest() throws Exception {
        mockMvc.perform(post("/transactions")
                        .header(PRINCIPAL, "cust-long-item")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"item": "%s", "quantity": 1, "price": 10, "durationMs": 1000}
                                """.formatted("i".repeat(256))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void invalidRating_isBadRequest() throws Exception {
        String id = acceptedAndFunded("cust-rate", "store-rate", 10);

        mockMvc.perform(post("/transactions/{id}/rating", id)
                        .header(PRINCIPAL, "cust-rate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\": 9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_RATING"));
    }

    @Test
    void missingPrincipalHeader_isBadRequest() throws Exception {
        String id = create("cust-hdr", 100, 1000);

        mockMvc.perform(post("/transactions/{id}/accept", id))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required header: X-Principal"));
    }

    @Test
    void unknownTransaction_isNotFound() throws Exception {
        mockMvc.perform(get("/transactions/{id}", "00000000-0000-0000-0000-000000000000"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TRANSACTION_NOT_FOUND"));
    }

    private String create(String customer, long price, long durationMs) throws Exception {
        MvcResult result = mockMvc.perform(post("/transactions")
                        .header(PRINCIPAL, customer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "item": "desk",
                                  "quantity": 1,
                                  "price": %d,
                                  "durationMs": %d
                                }
                                """.formatted(price, durationMs)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.customer").value(customer))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
    }

    private String acceptedAndFunded(String customer, String store, long amount) throws Exception {
        String id = create(customer, amount, 1000);
        mockMvc.perform(post("/transactions/{id}/accept", id).header(PRINCIPAL, store))
                .andExpect(status().isOk());
        mockMvc.perform(post("/transactions/{id}/funds", id)
                        .header(PRINCIPAL, customer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": %d}".formatted(amount)))
                .andExpect(status().isOk());
        return id;
    }

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        MutableClock mutableClock() {
            return new MutableClock(T0);
        }
    }
}
