package com.authgate.backend.modules.auth.presentation.dto;

import java.util.List;

public record OnlineUsersResponse(List<String> userIds, int count) {

    public static OnlineUsersResponse of(List<String> userIds) {
        return new OnlineUsersResponse(List.copyOf(userIds), userIds.size());
    }
}
