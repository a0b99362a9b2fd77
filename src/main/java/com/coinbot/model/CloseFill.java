package com.coinbot.model;

import lombok.Value;

/**
 * Exchange confirmation of a closing order.
 */
@Value
public class CloseFill {
    String orderId;
    double exitPrice;
}
