package com.userservice.db;

import com.userservice.config.ServiceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SchemaInitializerTest {

    private Database database;
    private SchemaInitializer initializer;

    @BeforeEach
    void setUp() throws SQLException {
        database = new Database(ServiceConfig.builder()
                .jdbcUrl("jdbc:h2:mem:schema-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .poolMinSize(1)
                .poolMaxSize(2)
                .build());
        database.initialize();
        initializer = new SchemaInitializer(database);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void createsUsersTableWithDatabaseDefaults() throws Exception {
        initializer.ensureTables();

        try (Connection conn = database.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO users (name, email) VALUES ('Ada', 'ada@example.com')");

            try (ResultSet rs = stmt.executeQuery("SELECT id, created_at FROM users")) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt("id"));
                assertNotNull(rs.getTimestamp("created_at"));
            }
        }
    }

    @Test
    void rerunningKeepsExistingRows() throws Exception {
        initializer.ensureTables();
        try (Connection conn = database.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO users (name, email) VALUES ('Ada', 'ada@example.com')");
        }

        initializer.ensureTables();
        initializer.ensureTables();

        try (Connection conn = database.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM users")) {
            rs.next();
            assertEquals(1, rs.getInt(1));
        }
    }

    @Test
    void emailIsUnique() throws Exception {
        initializer.ensureTables();

        try (Connection conn = database.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO users (name, email) VALUES ('Ada', 'ada@example.com')");

            SQLException e = assertThrows(SQLException.class, () ->
                    stmt.executeUpdate("INSERT INTO users (name, email) VALUES ('Other', 'ada@example.com')"));
            assertEquals("23505", e.getSQLState());
        }
    }

    @Test
    void failsOnClosedPool() {
        database.close();

        assertThrows(SQLException.class, () -> initializer.ensureTables());
    }
}
