package com.dentistflow.dentistflowserver.api;

import com.dentistflow.dentistflowserver.dto.ApiResponse;
import com.dentistflow.dentistflowserver.dto.UpdateProfileRequest;
import com.dentistflow.dentistflowserver.entity.User;
import com.dentistflow.dentistflowserver.security.SessionPrincipal;
import com.dentistflow.dentistflowserver.services.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Profile of the signed-in user. The {@code {id}} segment is kept for client
 * compatibility; both endpoints always act on the session's own account.
 */
@RestController
@RequestMapping("/api/user")
@RequiredArgsConstructor
public class UserApiController {

    private final UserService userService;

    @GetMapping("/{id}")
    public User getCurrentUser(@AuthenticationPrincipal SessionPrincipal caller,
                               @PathVariable("id") String ignoredId) {
        return userService.getProfile(caller);
    }

    @PutMapping("/{id}")
    public ApiResponse<User> updateCurrentUser(@AuthenticationPrincipal SessionPrincipal caller,
                                               @PathVariable("id") String ignoredId,
                                               @RequestBody UpdateProfileRequest request) {
        return ApiResponse.ok("Profile updated successfully", userService.updateProfile(caller, request));
    }
}
