package com.userstore.repository;

import com.userstore.model.User;
import com.userstore.storage.SqliteStorage;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class SqliteUserRepository implements UserRepository {

    private final SqliteStorage storage;

    private static final RowMapper<User> USER_MAPPER = (rs, rowNum) -> new User(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("email")
    );

    public SqliteUserRepository(SqliteStorage storage) {
        this.storage = storage;
    }

    @Override
    public User getById(Long id) {
        List<User> results = storage.query(
            "SELECT id, name, email FROM users WHERE id = ?",
            USER_MAPPER,
            id
        );
        if (results.isEmpty()) {
            throw new UserNotFoundException(id);
        }
        return results.get(0);
    }

    @Override
    public List<User> getAll() {
        return storage.query("SELECT id, name, email FROM users", USER_MAPPER);
    }

    @Override
    public User save(User user) {
        Long id = storage.insert(
            "INSERT INTO users (name, email) VALUES (?, ?) RETURNING id",
            user.name(), user.email()
        );
        return user.withId(id);
    }

    @Override
    public void update(User user) {
        storage.execute(
            "UPDATE users SET name = ?, email = ? WHERE id = ?",
            user.name(), user.email(), user.id()
        );
    }

    @Override
    public void delete(Long id) {
        storage.execute("DELETE FROM users WHERE id = ?", id);
    }
}
