package com.mk.fx.qa.load.traffic.rest;

/** Raised when a request could not be completed at the transport level. */
public class TransportException extends RuntimeException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
