package com.arkive.service.interfaces;

import com.arkive.models.dto.request.LoginRequest;
import com.arkive.models.dto.request.RegisterUserRequest;
import com.arkive.spi.models.User;

public interface UserService {

    User register(RegisterUserRequest request);

    /**
     * Checks the credentials and records the attempt, successful or not.
     */
    User login(LoginRequest request);
}
