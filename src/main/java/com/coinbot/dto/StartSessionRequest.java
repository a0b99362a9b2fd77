package com.coinbot.dto;

import lombok.Data;

import java.util.List;

/**
 * Optional overrides for a session start. Missing fields fall back to configuration.
 */
@Data
public class StartSessionRequest {

    /** false starts the session in signal-monitoring mode */
    private Boolean executeOrders;

    private List<String> coins;
}
