package lab.escrow.common;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@Import(GlobalExceptionHandlerTest.TestConfig.class)
@AutoConfigureMockMvc
class GlobalExceptionHandlerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void runtimeExceptionMessage_hasRecordIdsRedacted() throws Exception {
        mockMvc.perform(get("/test-error").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.path").value("/test-error"))
                .andExpect(jsonPath("$.message").value("Lost track of transaction [REDACTED]"));
    }

    @Test
    void escrowException_isMappedToItsStatusAndCode() throws Exception {
        mockMvc.perform(get("/test-escrow-error"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_STORE"))
                .andExpect(jsonPath("$.message").value("caller is not the assigned store"));
    }

    @Test
    void malformedBody_isBadRequest() throws Exception {
        mockMvc.perform(post("/transactions")
                        .header("X-Principal", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void correlationId_isEchoedBack() throws Exception {
        mockMvc.perform(get("/test-escrow-error").header("X-Correlation-Id", "cid-42"))
                .andExpect(header().string("X-Correlation-Id", "cid-42"));
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        TestErrorController testErrorController() {
            return new TestErrorController();
        }
    }

    @RestController
    static class TestErrorController {
        @GetMapping("/test-error")
        String error() {
            throw new IllegalStateException("Lost track of transaction 3f2b8c1e-9d4a-4b7e-8c21-5a6f0e9d1b23");
        }

        @GetMapping("/test-escrow-error")
        String escrowError() {
            throw new EscrowException(EscrowErrorCode.NOT_STORE, "caller is not the assigned store");
        }
    }
}
