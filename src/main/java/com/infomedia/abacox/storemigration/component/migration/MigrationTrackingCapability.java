package com.infomedia.abacox.storemigration.component.migration;

import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Whether migration outcomes can be persisted. Decided once, when the application starts: the
 * feature must be enabled and the outcome table must exist.
 */
@Component
@Log4j2
@DependsOn("entityManagerFactory")
public class MigrationTrackingCapability {

    static final String OUTCOME_TABLE = "customer_migration";

    private final boolean available;

    public MigrationTrackingCapability(DataSource dataSource,
                                       @Value("${store-migration.migration.track-outcomes:true}") boolean enabled) {
        this.available = enabled && tableExists(dataSource, OUTCOME_TABLE);
        log.info("Migration outcome tracking {}", available ? "enabled" : "disabled");
    }

    public boolean isAvailable() {
        return available;
    }

    private static boolean tableExists(DataSource dataSource, String table) {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            for (String candidate : new String[]{table, table.toUpperCase(Locale.ROOT)}) {
                try (ResultSet tables = metaData.getTables(null, null, candidate, new String[]{"TABLE"})) {
                    if (tables.next()) {
                        return true;
                    }
                }
            }
            log.warn("Table {} not found, migration outcomes will only be logged", table);
            return false;
        } catch (SQLException e) {
            log.warn("Could not inspect database metadata, migration outcomes will only be logged: {}", e.getMessage());
            return false;
        }
    }
}
