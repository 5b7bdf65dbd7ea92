package com.perpetua.backend.db;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;

class FlywayMigrationTest {

    private static final String URL = "jdbc:h2:mem:flyway_check;MODE=PostgreSQL;DB_CLOSE_DELAY=-1";

    @Test
    void migrationsApply() throws Exception {
        Flyway flyway = Flyway.configure()
                .dataSource(URL, "sa", "")
                .locations("classpath:db/migration")
                .load();

        MigrateResult result = flyway.migrate();

        assertThat(result.migrationsExecuted).isGreaterThanOrEqualTo(1);
        assertThat(flyway.info().applied()).isNotEmpty();

        try (Connection connection = DriverManager.getConnection(URL, "sa", "");
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("INSERT INTO positions (symbol, status, entry_price, entry_amount, entry_leverage, opened_at) "
                    + "VALUES ('BTC', 'OPEN', 50000, 0.002, 5, CURRENT_TIMESTAMP)");
            statement.executeUpdate("INSERT INTO trades (symbol, operation, status, position_id, created_at) "
                    + "SELECT 'BTC', 'BUY', 'FILLED', id, CURRENT_TIMESTAMP FROM positions");
            try (ResultSet rows = statement.executeQuery("SELECT realized_pnl FROM positions")) {
                assertThat(rows.next()).isTrue();
                assertThat(rows.getDouble(1)).isZero();
            }
        }
    }
}
