package uk.gegc.revisionhelper.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Single source of time for revisions, runs, answers and user accounts.
 * <p>
 * Both storage backends receive their timestamps from this clock through
 * {@code StorageAdapter}, so swapping it for a fixed clock makes every stored
 * instant predictable in tests.
 */
@Configuration
@Slf4j
public class ClockConfig {

    static final String DEFAULT_ZONE = "UTC";

    /**
     * Zone the clock reports in. Stored instants are zone-independent.
     */
    @Value("${app.timezone:" + DEFAULT_ZONE + "}")
    private String timezone;

    /**
     * @return system clock in the configured zone
     * @throws IllegalStateException if {@code app.timezone} is not a valid zone id
     */
    @Bean
    public Clock clock() {
        return Clock.system(resolveZone(timezone));
    }

    static ZoneId resolveZone(String configured) {
        if (configured == null || configured.isBlank()) {
            return ZoneId.of(DEFAULT_ZONE);
        }
        try {
            ZoneId zone = ZoneId.of(configured.trim());
            log.debug("Application clock uses zone {}", zone);
            return zone;
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid app.timezone '" + configured + "': " + e.getMessage(), e);
        }
    }
}
