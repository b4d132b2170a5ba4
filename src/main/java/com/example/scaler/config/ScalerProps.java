package com.example.scaler.config;

public interface ScalerProps {
    long timeoutMs();

    String defaultQueue();

    Admin admin();

    interface Admin {
        String baseUrl();
    }
}
