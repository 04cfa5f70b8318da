package com.dentistflow.dentistflowserver.dto;

import com.dentistflow.dentistflowserver.entity.User;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class LoginResponse {
    private String token;
    private User user;
}
