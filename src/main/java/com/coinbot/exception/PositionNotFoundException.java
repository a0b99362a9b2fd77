package com.coinbot.exception;

public class PositionNotFoundException extends RuntimeException {

    public PositionNotFoundException(String coin) {
        super("No tracked position for coin " + coin);
    }
}
