package com.userservice.core;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A row of the {@code users} table.
 *
 * <p>The id and creation timestamp are assigned by the database; instances are
 * only built from query results.</p>
 */
public final class User {
    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_EMAIL_LENGTH = 100;

    private final int id;
    private final String name;
    private final String email;
    private final LocalDateTime createdAt;

    public User(int id, String name, String email, LocalDateTime createdAt) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.email = Objects.requireNonNull(email, "email");
        this.createdAt = createdAt;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    /**
     * @return the database-assigned creation time, or null if the column was null
     */
    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof User)) return false;
        User other = (User) o;
        return id == other.id
                && name.equals(other.name)
                && email.equals(other.email)
                && Objects.equals(createdAt, other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, email, createdAt);
    }

    @Override
    public String toString() {
        return "User{id=" + id + ", name='" + name + "', email='" + email + "', createdAt=" + createdAt + "}";
    }
}
