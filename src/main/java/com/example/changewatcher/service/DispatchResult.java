package com.example.changewatcher.service;

public enum DispatchResult {
        DELIVERED,
        HANDLER_FAILED
}
