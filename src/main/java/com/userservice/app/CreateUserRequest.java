package com.userservice.app;

import com.userservice.core.User;

/**
 * Body of {@code POST /users}: {@code {"name": "...", "email": "..."}}.
 * Populated by Gson, so fields stay mutable and may be null.
 */
class CreateUserRequest {
    private String name;
    private String email;

    CreateUserRequest() {}

    CreateUserRequest(String name, String email) {
        this.name = name;
        this.email = email;
    }

    /**
     * @throws IllegalArgumentException naming the first field that is missing, blank or too long
     */
    void validate() {
        requireText("name", name, User.MAX_NAME_LENGTH);
        requireText("email", email, User.MAX_EMAIL_LENGTH);
        if (email.trim().indexOf('@') <= 0) {
            throw new IllegalArgumentException("email must be an email address");
        }
    }

    String getName() {
        return name.trim();
    }

    String getEmail() {
        return email.trim();
    }

    private static void requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (value.trim().length() > maxLength) {
            throw new IllegalArgumentException(field + " must be at most " + maxLength + " characters");
        }
    }
}
