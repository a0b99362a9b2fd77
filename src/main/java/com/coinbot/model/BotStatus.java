package com.coinbot.model;

public enum BotStatus {
    RUNNING,
    STOPPED
}
