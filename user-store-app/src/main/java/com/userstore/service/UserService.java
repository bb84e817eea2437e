package com.userstore.service;

import com.userstore.model.User;
import com.userstore.repository.UserRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class UserService {

    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public User getUser(Long id) {
        return userRepository.getById(id);
    }

    public List<User> getAllUsers() {
        return userRepository.getAll();
    }

    /**
     * Store a new user.
     *
     * @return the stored user with its assigned id
     */
    public User createUser(String name, String email) {
        return userRepository.save(User.unsaved(name, email));
    }

    /**
     * Replace name and email of an existing user. The read and the write are separate
     * statements; a concurrent delete between them is not detected.
     *
     * @throws com.userstore.repository.UserNotFoundException if the user does not exist
     */
    public void updateUser(Long id, String name, String email) {
        User existing = userRepository.getById(id);
        userRepository.update(existing.withDetails(name, email));
    }

    public void deleteUser(Long id) {
        userRepository.delete(id);
    }
}
