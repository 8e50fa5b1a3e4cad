package com.example.changewatcher.models;

public enum WatcherState {
    IDLE,
    CONNECTING,
    STREAMING,
    RECONNECTING,
    CLOSING,
    CLOSED,
    FAILED
}
