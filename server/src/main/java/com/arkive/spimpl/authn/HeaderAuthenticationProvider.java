package com.arkive.spimpl.authn;

import com.arkive.spi.ArkiveAuthenticationProvider;
import com.arkive.spi.authn.ArkiveUser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.BadCredentialsException;

/**
 * Trusts the identity headers set by the desktop shell, which logs the user in before calling the API.
 */
public class HeaderAuthenticationProvider implements ArkiveAuthenticationProvider {

    public static final String USER_ID_HEADER = "X-Arkive-User-Id";
    public static final String USERNAME_HEADER = "X-Arkive-Username";

    private static final int MAX_LENGTH = 255;

    @Override
    public ArkiveUser authenticate(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId == null) {
            return null;
        }
        if (userId.isBlank() || userId.length() > MAX_LENGTH) {
            throw new BadCredentialsException("Invalid " + USER_ID_HEADER + " header");
        }
        String username = request.getHeader(USERNAME_HEADER);
        if (username == null || username.isBlank()) {
            username = userId;
        } else if (username.length() > MAX_LENGTH) {
            throw new BadCredentialsException("Invalid " + USERNAME_HEADER + " header");
        }
        return new SimpleArkiveUser(userId, username);
    }
}
