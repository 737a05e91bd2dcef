package com.magicminds.backend.modules.voice.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record CheckoutRequest(
        @Email String email,
        @Size(max = 120) String name
) {
}
