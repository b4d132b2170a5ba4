package com.example.scaler.web.dto;

public record ErrorResponse(String error) {}
