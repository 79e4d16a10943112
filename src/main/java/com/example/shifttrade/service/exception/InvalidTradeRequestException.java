package com.example.shifttrade.service.exception;

/** The request itself breaks the contract (missing ids, untradable trader shift). */
public class InvalidTradeRequestException extends RuntimeException {

    public InvalidTradeRequestException(String message) {
        super(message);
    }
}
