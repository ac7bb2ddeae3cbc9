package com.chirpy.api.error;

public record ErrorResponse(String error) {}
