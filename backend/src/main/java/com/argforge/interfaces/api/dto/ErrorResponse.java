package com.argforge.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
