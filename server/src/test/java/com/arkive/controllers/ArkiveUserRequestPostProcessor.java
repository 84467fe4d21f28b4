package com.arkive.controllers;

import com.arkive.spi.authn.ArkiveUser;
import com.arkive.spimpl.authn.SimpleArkiveUser;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;

public class ArkiveUserRequestPostProcessor implements RequestPostProcessor {

    private final String userId;
    private String username;

    private ArkiveUserRequestPostProcessor(String userId) {
        this.userId = userId;
        this.username = userId;
    }

    public static ArkiveUserRequestPostProcessor user(String userId) {
        return new ArkiveUserRequestPostProcessor(userId);
    }

    public ArkiveUserRequestPostProcessor named(String username) {
        this.username = username;
        return this;
    }

    @Override
    public MockHttpServletRequest postProcessRequest(MockHttpServletRequest request) {
        ArkiveUser user = new SimpleArkiveUser(userId, username);
        RequestPostProcessor authenticationPostProcessor = authentication(UsernamePasswordAuthenticationToken.authenticated(user, null, AuthorityUtils.createAuthorityList("ROLE_USER")));
        return authenticationPostProcessor.postProcessRequest(request);
    }
}
