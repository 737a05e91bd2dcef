package com.magicminds.backend.modules.profile.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UpdateChildStatusRequest(
        @JsonProperty("isOnline") Boolean online
) {
}
