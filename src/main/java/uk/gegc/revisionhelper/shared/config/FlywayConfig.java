package uk.gegc.revisionhelper.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migration strategy for the relational backend. A failed migration left behind by an
 * earlier start is repaired before migrating, unless {@code revision.flyway.repair-on-start} is off.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "spring.datasource", name = "url")
public class FlywayConfig {

    @Value("${revision.flyway.repair-on-start:true}")
    private boolean repairOnStart;

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return (Flyway flyway) -> {
            if (repairOnStart) {
                try {
                    flyway.repair();
                } catch (FlywayException e) {
                    log.warn("Flyway repair of the revision schema failed, migrating anyway: {}", e.getMessage());
                }
            }
            int applied = flyway.migrate().migrationsExecuted;
            log.info("Revision schema up to date, {} migrations applied", applied);
        };
    }
}
