package com.arkive.controllers;

import com.arkive.models.dto.request.LoginRequest;
import com.arkive.models.dto.request.RegisterUserRequest;
import com.arkive.models.dto.response.ResponseTemplate;
import com.arkive.service.interfaces.UserService;
import com.arkive.spi.models.User;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @Operation(summary = "Registers a new local user.")
    @PostMapping("/v1/users")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseTemplate<User> register(@Valid @RequestBody RegisterUserRequest request) {
        return ResponseTemplate.success(userService.register(request), "Successfully registered user.");
    }

    @Operation(summary = "Checks credentials. The returned user id goes into the identity headers of later calls.")
    @PostMapping("/v1/sessions")
    public ResponseTemplate<User> login(@Valid @RequestBody LoginRequest request) {
        return ResponseTemplate.success(userService.login(request), "Successfully logged in.");
    }
}
