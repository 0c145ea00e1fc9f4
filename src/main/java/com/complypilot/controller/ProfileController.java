package com.complypilot.controller;

import com.complypilot.model.ProfileUpdate;
import com.complypilot.model.User;
import com.complypilot.service.UserProfileService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users/profile")
public class ProfileController {

    private final UserProfileService profileService;

    public ProfileController(UserProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping
    public User get(@CurrentUser User user) {
        return user;
    }

    @PutMapping
    public User update(@CurrentUser User user, @RequestBody ProfileUpdate update) {
        return profileService.update(user, update);
    }
}
