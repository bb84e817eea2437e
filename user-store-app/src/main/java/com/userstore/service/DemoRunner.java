package com.userstore.service;

import com.userstore.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Walks one user through create, read, list, update and delete at startup.
 * Any exception escapes and aborts startup.
 */
@Component
@ConditionalOnProperty(prefix = "userstore.demo", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DemoRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoRunner.class);

    private final UserService userService;

    public DemoRunner(UserService userService) {
        this.userService = userService;
    }

    @Override
    public void run(String... args) {
        User created = userService.createUser("John Doe", "john@example.com");

        User fetched = userService.getUser(created.id());
        log.info("Fetched {} {} {}", fetched.id(), fetched.name(), fetched.email());

        for (User user : userService.getAllUsers()) {
            log.info("Listed {} {} {}", user.id(), user.name(), user.email());
        }

        userService.updateUser(created.id(), "John Smith", "john.smith@example.com");
        User updated = userService.getUser(created.id());
        log.info("Updated {} {} {}", updated.id(), updated.name(), updated.email());

        userService.deleteUser(created.id());
        log.info("Deleted {}", created.id());
    }
}
