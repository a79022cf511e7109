package com.intteq.universal.pubsub;

public class OutOfStockException extends Exception {

    public OutOfStockException(String message) {
        super(message);
    }
}
