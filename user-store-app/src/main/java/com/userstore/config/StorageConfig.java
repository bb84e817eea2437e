package com.userstore.config;

import com.userstore.storage.SqliteStorage;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

@Configuration
public class StorageConfig {

    @Bean
    public HikariDataSource dataSource(StorageProperties properties) {
        return createDataSource(properties.getLocation());
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public SqliteStorage sqliteStorage(JdbcTemplate jdbcTemplate, StorageProperties properties) {
        SqliteStorage storage = new SqliteStorage(jdbcTemplate, properties.getLocation());
        storage.initialize();
        return storage;
    }

    /**
     * One pooled connection is the process-wide handle, so statements from concurrent
     * callers queue for it. It is never retired, which keeps ":memory:" databases alive.
     */
    public static HikariDataSource createDataSource(String location) {
        HikariDataSource dataSource = DataSourceBuilder.create()
            .type(HikariDataSource.class)
            .driverClassName("org.sqlite.JDBC")
            .url("jdbc:sqlite:" + location)
            .build();
        dataSource.setMaximumPoolSize(1);
        dataSource.setMaxLifetime(0);
        dataSource.setPoolName("userstore");
        return dataSource;
    }
}
