package com.userstore.service;

import com.userstore.model.User;
import com.userstore.repository.UserNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Service against the real SQLite backend, starting from an empty table.
 */
@SpringBootTest
@ActiveProfiles("test")
@Sql("/reset-users.sql")
class UserServiceIntegrationTest {

    @Autowired
    private UserService userService;

    @Autowired
    private ApplicationContext context;

    @Test
    void createFetchUpdateDeleteScenario() {
        User created = userService.createUser("John Doe", "john@example.com");
        assertThat(created.id()).isEqualTo(1L);

        assertThat(userService.getUser(1L)).isEqualTo(new User(1L, "John Doe", "john@example.com"));

        userService.updateUser(1L, "John Smith", "john.smith@example.com");
        assertThat(userService.getUser(1L)).isEqualTo(new User(1L, "John Smith", "john.smith@example.com"));

        userService.deleteUser(1L);
        assertThatThrownBy(() -> userService.getUser(1L)).isInstanceOf(UserNotFoundException.class);
    }

    @Test
    void getAllUsersOnEmptyTableIsEmpty() {
        assertThat(userService.getAllUsers()).isEmpty();
    }

    @Test
    void updateUserOnMissingIdFailsWithNotFound() {
        assertThatThrownBy(() -> userService.updateUser(1L, "John Smith", "john.smith@example.com"))
            .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    void deleteUserOnMissingIdSucceeds() {
        User created = userService.createUser("John Doe", "john@example.com");

        userService.deleteUser(created.id() + 1);

        assertThat(userService.getAllUsers()).containsExactly(created);
    }

    @Test
    void demoRunnerIsDisabledInTests() {
        assertThat(context.getBeansOfType(DemoRunner.class)).isEmpty();
    }
}
