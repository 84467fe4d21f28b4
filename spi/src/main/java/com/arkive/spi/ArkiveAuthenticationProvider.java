package com.arkive.spi;

import com.arkive.spi.authn.ArkiveUser;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the already verified identity of the caller. The store never authenticates anybody itself; the desktop
 * shell or a fronting proxy does and passes the result along.
 */
public interface ArkiveAuthenticationProvider {

    /**
     * @return the caller, or null when the request carries no identity
     * @throws org.springframework.security.core.AuthenticationException when an identity is present but malformed
     */
    ArkiveUser authenticate(HttpServletRequest request);
}
