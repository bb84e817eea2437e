package com.userstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Where the users table lives. Set in application.yml under 'userstore.storage'.
 * Accepts a file path or ":memory:".
 */
@Configuration
@ConfigurationProperties(prefix = "userstore.storage")
public class StorageProperties {

    private String location = "users.db";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
