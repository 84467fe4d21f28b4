package com.arkive.service.utils;

import com.arkive.spi.authn.ArkiveUser;
import com.arkive.spi.models.Actor;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component
public class AuthnUtil {

    public Actor currentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof ArkiveUser user) {
            return new Actor(user.getUserId(), user.getName());
        }
        throw new AuthenticationCredentialsNotFoundException("No authenticated user");
    }

    public String currentUserId() {
        return currentActor().userId();
    }
}
