package com.coinbot.service.exchange;

import com.coinbot.exception.ExchangeException;
import com.coinbot.model.AccountState;
import com.coinbot.model.CloseFill;
import com.coinbot.model.OrderFill;
import com.coinbot.model.PositionSide;
import com.coinbot.model.PositionSnapshot;

/**
 * Contract with the exchange. Implementations may block and may fail; every failure,
 * including a timeout, is reported as {@link ExchangeException}.
 */
public interface ExchangeClient {

    /**
     * Opens a position of {@code size} base units at market.
     */
    OrderFill placeOrder(String coin, PositionSide side, double size) throws ExchangeException;

    /**
     * Closes the exchange position described by {@code position} at market.
     */
    CloseFill closePosition(PositionSnapshot position) throws ExchangeException;

    double getMarkPrice(String coin) throws ExchangeException;

    AccountState getAccountState() throws ExchangeException;
}
