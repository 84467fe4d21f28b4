package com.arkive.spi.authn;

import java.security.Principal;

public interface ArkiveUser extends Principal {

    /**
     * Stable identifier of the user, used as the actor id in audit entries.
     */
    String getUserId();
}
