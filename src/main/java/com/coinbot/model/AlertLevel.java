package com.coinbot.model;

public enum AlertLevel {
    INFO,
    WARNING,
    CRITICAL
}
