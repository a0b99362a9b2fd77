package com.coinbot.service.order;

import com.coinbot.model.Position;

/**
 * Receives ownership of a position the moment it becomes OPEN.
 */
@FunctionalInterface
public interface PositionHandoff {

    void onPositionOpened(Position position);
}
