package com.coinbot.model;

import lombok.Value;

/**
 * Exchange confirmation of an opening order.
 */
@Value
public class OrderFill {
    String orderId;
    double entryPrice;
    double filledSize;
}
