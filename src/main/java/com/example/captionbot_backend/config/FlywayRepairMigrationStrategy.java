package com.example.captionbot_backend.config;

import org.flywaydb.core.api.output.MigrateResult;
import org.flywaydb.core.api.output.RepairResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Repairs the schema history before migrating, so a locally edited migration does not block
 * startup of an existing transcript database with a checksum mismatch.
 */
@Configuration
public class FlywayRepairMigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlywayRepairMigrationStrategy.class);

    @Bean
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            RepairResult repair = flyway.repair();
            if (!repair.migrationsAligned.isEmpty() || !repair.migrationsRemoved.isEmpty()) {
                LOGGER.warn("Flyway schema history repaired aligned={} removed={}",
                        repair.migrationsAligned.size(), repair.migrationsRemoved.size());
            }
            MigrateResult result = flyway.migrate();
            LOGGER.info("Transcript schema ready version={} applied={}", result.targetSchemaVersion, result.migrationsExecuted);
        };
    }
}
