package com.yamdb.backend.modules.auth.presentation.dto;

import com.yamdb.backend.modules.auth.domain.YamdbUser;

public final class UserDtoMapper {

    private UserDtoMapper() {
    }

    public static UserResponse toResponse(YamdbUser user) {
        return new UserResponse(
                user.getUsername(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getBio(),
                user.getRole()
        );
    }
}
