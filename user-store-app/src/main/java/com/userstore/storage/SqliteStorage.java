package com.userstore.storage;

import com.zaxxer.hikari.pool.HikariPool.PoolInitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;

/**
 * Owns the SQLite file holding the users table and runs parameterized statements against it.
 */
public class SqliteStorage {

    private static final Logger log = LoggerFactory.getLogger(SqliteStorage.class);

    private static final String CREATE_USERS_TABLE = """
        CREATE TABLE IF NOT EXISTS users (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT,
            email TEXT
        )
        """;

    private final JdbcTemplate jdbc;
    private final String location;

    public SqliteStorage(JdbcTemplate jdbc, String location) {
        this.jdbc = jdbc;
        this.location = location;
    }

    /**
     * Open the storage location and create the users table if it is missing.
     * Safe to call against an already initialized location.
     *
     * @throws StorageInitializationException if the location cannot be opened or the table created
     */
    public void initialize() {
        log.info("Opening user storage at {}", location);
        try {
            jdbc.execute(CREATE_USERS_TABLE);
        } catch (DataAccessException | PoolInitializationException e) {
            throw new StorageInitializationException(
                "Failed to initialize user storage at " + location + ": " + e.getMessage(), e);
        }
    }

    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... args) {
        return jdbc.query(sql, mapper, args);
    }

    /**
     * Run an INSERT ... RETURNING id statement.
     *
     * @return the identifier storage assigned to the new row
     * @throws StorageWriteException if the statement fails
     */
    public Long insert(String sql, Object... args) {
        try {
            return jdbc.queryForObject(sql, Long.class, args);
        } catch (DataAccessException e) {
            throw new StorageWriteException("Insert failed: " + e.getMessage(), e);
        }
    }

    /**
     * Run an UPDATE or DELETE statement.
     *
     * @return number of rows affected
     * @throws StorageWriteException if the statement fails
     */
    public int execute(String sql, Object... args) {
        try {
            return jdbc.update(sql, args);
        } catch (DataAccessException e) {
            throw new StorageWriteException("Write failed: " + e.getMessage(), e);
        }
    }
}
