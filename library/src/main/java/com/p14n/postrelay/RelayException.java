package com.p14n.postrelay;

/**
 * Unchecked failure raised when the relay cannot be set up or used.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
