package com.arkive.authn;

import com.arkive.spi.ArkiveAuthenticationProvider;
import lombok.AllArgsConstructor;
import org.springframework.security.config.annotation.SecurityConfigurer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.DefaultSecurityFilterChain;
import org.springframework.security.web.context.SecurityContextHolderFilter;

@AllArgsConstructor
public class AuthenticationFilterSecurityConfigurer implements SecurityConfigurer<DefaultSecurityFilterChain, HttpSecurity> {

    private final ArkiveAuthenticationProvider authenticationProvider;

    @Override
    public void init(HttpSecurity builder) {
        // nothing to share with other configurers
    }

    @Override
    public void configure(HttpSecurity http) {
        http.addFilterAfter(new AuthenticationFilter(authenticationProvider), SecurityContextHolderFilter.class);
    }
}
