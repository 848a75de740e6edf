package com.userservice.db;

import com.userservice.core.DuplicateEmailException;
import com.userservice.core.User;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Repository for the {@code users} table.
 * Every method borrows a pooled connection for the duration of one statement.
 */
public class UserRepository {
    private static final Logger logger = Logger.getLogger(UserRepository.class.getName());

    // SQLSTATE for unique_violation, shared by PostgreSQL and H2
    private static final String UNIQUE_VIOLATION = "23505";

    private final Database database;

    public UserRepository(Database database) {
        this.database = database;
    }

    /**
     * List every user.
     *
     * @return all users ordered by id, empty if the table is empty
     * @throws SQLException if the query fails or no connection is available
     */
    public List<User> findAll() throws SQLException {
        String sql = "SELECT id, name, email, created_at FROM users ORDER BY id";
        List<User> users = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                users.add(mapResultSetToUser(rs));
            }
        }

        logger.fine("Retrieved " + users.size() + " users");
        return users;
    }

    /**
     * Look up a single user.
     *
     * @param id the user id
     * @return the user, or empty if no row has that id
     * @throws SQLException if the query fails
     */
    public Optional<User> findById(int id) throws SQLException {
        String sql = "SELECT id, name, email, created_at FROM users WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setInt(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToUser(rs));
                }
            }
        }

        return Optional.empty();
    }

    /**
     * Insert a user. The id and creation time come from the database.
     *
     * @param name  display name
     * @param email email address, must not belong to another user
     * @return the stored row
     * @throws DuplicateEmailException if the email is already taken
     * @throws SQLException            if the insert fails for any other reason
     */
    public User create(String name, String email) throws SQLException {
        String sql = "INSERT INTO users (name, email) VALUES (?, ?)";
        int id;

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setString(1, name);
            stmt.setString(2, email);
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("Insert into users returned no generated id");
                }
                id = keys.getInt(1);
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new DuplicateEmailException(email, e);
            }
            throw e;
        }

        final int createdId = id;
        logger.info("Created user " + createdId);
        return findById(createdId)
                .orElseThrow(() -> new SQLException("User " + createdId + " vanished right after insert"));
    }

    /**
     * @return the number of rows in the users table
     * @throws SQLException if the query fails
     */
    public int count() throws SQLException {
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM users");
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private User mapResultSetToUser(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new User(
                rs.getInt("id"),
                rs.getString("name"),
                rs.getString("email"),
                createdAt != null ? createdAt.toLocalDateTime() : null);
    }
}
