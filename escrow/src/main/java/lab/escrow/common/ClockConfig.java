package lab.escrow.common;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Deadline comparisons read time only through this bean so tests can pin it.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
