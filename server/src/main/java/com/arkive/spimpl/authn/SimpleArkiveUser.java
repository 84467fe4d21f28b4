package com.arkive.spimpl.authn;

import com.arkive.spi.authn.ArkiveUser;

public record SimpleArkiveUser(String userId, String name) implements ArkiveUser {

    @Override
    public String getUserId() {
        return userId;
    }

    @Override
    public String getName() {
        return name;
    }
}
