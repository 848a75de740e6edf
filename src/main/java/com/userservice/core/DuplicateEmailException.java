package com.userservice.core;

/**
 * Thrown when a user is created with an email that is already taken.
 *
 * <p>The uniqueness rule lives in the database ({@code UNIQUE} on
 * {@code users.email}); this exception translates the driver's constraint
 * violation so callers can answer with a conflict instead of a server error.</p>
 */
public class DuplicateEmailException extends RuntimeException {

    private final String email;

    public DuplicateEmailException(String email, Throwable cause) {
        super("A user with email '" + email + "' already exists", cause);
        this.email = email;
    }

    /**
     * @return the email that collided with an existing row
     */
    public String getEmail() {
        return email;
    }
}
