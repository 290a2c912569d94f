package com.authgate.backend.modules.auth.application;

import java.util.List;

import com.authgate.backend.modules.session.domain.DeviceInfo;

/**
 * Input of a login after the caller has verified the user's credentials.
 */
public record StartSessionCommand(
        String userId,
        List<String> roles,
        String deviceId,
        DeviceInfo deviceInfo,
        String ipAddress,
        String userAgent
) {

    public StartSessionCommand {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
