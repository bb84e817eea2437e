package com.userstore.model;

/**
 * A row of the users table. The id is null until storage assigns one.
 */
public record User(
    Long id,
    String name,
    String email
) {
    public static User unsaved(String name, String email) {
        return new User(null, name, email);
    }

    public User withId(Long newId) {
        return new User(newId, name, email);
    }

    public User withDetails(String newName, String newEmail) {
        return new User(id, newName, newEmail);
    }
}
