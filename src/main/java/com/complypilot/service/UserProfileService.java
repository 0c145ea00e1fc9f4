package com.complypilot.service;

import com.complypilot.model.ProfileUpdate;
import com.complypilot.model.User;
import com.complypilot.repository.UserRepository;
import org.springframework.stereotype.Service;

@Service
public class UserProfileService {

    private final UserRepository userRepository;

    public UserProfileService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /** Applies the non-null fields of the update and returns the stored profile. */
    public User update(User user, ProfileUpdate update) {
        if (update == null) return user;
        return userRepository.save(user.withProfileUpdate(update));
    }
}
