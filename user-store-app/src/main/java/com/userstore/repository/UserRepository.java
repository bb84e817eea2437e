package com.userstore.repository;

import com.userstore.model.User;

import java.util.List;

/**
 * CRUD over user records. One implementation per storage technology.
 */
public interface UserRepository {

    /**
     * @throws UserNotFoundException if no row has this id
     */
    User getById(Long id);

    /**
     * All users in storage order; empty when the table is empty.
     */
    List<User> getAll();

    /**
     * Insert the user's name and email. Any id on the argument is ignored.
     *
     * @return the stored user, carrying the id storage assigned
     */
    User save(User user);

    /**
     * Overwrite name and email of the row with the user's id. Does nothing if there is no such row.
     */
    void update(User user);

    /**
     * Does nothing if there is no row with this id.
     */
    void delete(Long id);
}
