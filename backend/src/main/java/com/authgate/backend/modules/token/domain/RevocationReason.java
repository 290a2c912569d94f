package com.authgate.backend.modules.token.domain;

public final class RevocationReason {

    public static final String ROTATED = "ROTATED";
    public static final String LOGOUT = "LOGOUT";
    public static final String FORCED = "FORCED";

    private RevocationReason() {
    }
}
