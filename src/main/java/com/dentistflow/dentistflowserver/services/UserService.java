package com.dentistflow.dentistflowserver.services;

import com.dentistflow.dentistflowserver.dto.UpdateProfileRequest;
import com.dentistflow.dentistflowserver.entity.User;
import com.dentistflow.dentistflowserver.exception.NotFoundException;
import com.dentistflow.dentistflowserver.exception.ValidationException;
import com.dentistflow.dentistflowserver.repository.UserRepository;
import com.dentistflow.dentistflowserver.security.AccessPolicy;
import com.dentistflow.dentistflowserver.security.Operation;
import com.dentistflow.dentistflowserver.security.SessionPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * User directory: lookups for other services and the caller's own profile.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final AccessPolicy accessPolicy;

    public Optional<User> findUser(Long id) {
        if (id == null) return Optional.empty();
        return userRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public User getProfile(SessionPrincipal caller) {
        accessPolicy.check(caller, Operation.VIEW_PROFILE);
        return findUser(caller.getUserId())
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    /**
     * Only the full name can change. Appointments booked earlier keep the name they
     * were booked with.
     */
    @Transactional
    public User updateProfile(SessionPrincipal caller, UpdateProfileRequest request) {
        accessPolicy.check(caller, Operation.UPDATE_PROFILE);

        String fullName = request != null ? request.getFullName() : null;
        if (fullName == null || fullName.isBlank()) {
            throw new ValidationException("No update fields provided");
        }

        User user = findUser(caller.getUserId())
                .orElseThrow(() -> new NotFoundException("User not found"));
        user.setFullName(fullName.trim());
        user = userRepository.save(user);

        log.info("User {} updated profile", user.getId());
        return user;
    }
}
