package com.userservice.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Logger;

/**
 * Creates the {@code users} table if it does not exist yet.
 *
 * <p>The identity column syntax is understood by both PostgreSQL and H2, so the same
 * statement runs against either backend. Running it again leaves existing rows alone.</p>
 */
public class SchemaInitializer {
    private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

    static final String CREATE_USERS_TABLE =
            "CREATE TABLE IF NOT EXISTS users ("
            + " id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " name VARCHAR(100) NOT NULL,"
            + " email VARCHAR(100) UNIQUE NOT NULL,"
            + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP"
            + ")";

    private final Database database;

    public SchemaInitializer(Database database) {
        this.database = database;
    }

    /**
     * Run the table bootstrap on a pooled connection.
     *
     * @throws SQLException if the DDL fails
     */
    public void ensureTables() throws SQLException {
        logger.info("Ensuring users table exists...");

        try (Connection conn = database.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_USERS_TABLE);
        }

        logger.info("Users table ready");
    }
}
