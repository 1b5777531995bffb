package com.msgrelay.core.message;

/**
 * Thrown when a payload received on the socket hop is not a JSON object.
 */
public class MessageDecodingException extends Exception {

    public MessageDecodingException(String message) {
        super(message);
    }

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
