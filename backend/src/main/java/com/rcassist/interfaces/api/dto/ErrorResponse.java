package com.rcassist.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
