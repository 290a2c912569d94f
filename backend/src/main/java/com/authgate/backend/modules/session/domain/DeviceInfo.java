package com.authgate.backend.modules.session.domain;

public record DeviceInfo(String fingerprint, String platform, String device, String browser) {

    public static final String UNKNOWN = "unknown";

    public static DeviceInfo unknown() {
        return new DeviceInfo(null, UNKNOWN, UNKNOWN, UNKNOWN);
    }
}
