package com.dentistflow.dentistflowserver.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {
    @NotBlank(message = "must not be blank")
    private String fullName;

    @NotBlank(message = "must not be blank")
    @Email(message = "must be a well-formed email address")
    private String email;

    @NotBlank(message = "must not be blank")
    @Size(min = 8, message = "must be at least 8 characters")
    private String password;

    private String role; // client by default
    private String phone;
}
