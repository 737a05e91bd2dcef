package com.magicminds.backend.modules.voice.presentation.dto;

public record CheckoutResponse(String url) {
}
