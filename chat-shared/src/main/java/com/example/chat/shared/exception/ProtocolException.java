package com.example.chat.shared.exception;

/**
 * A client frame could not be understood: malformed JSON, a missing envelope field or an
 * unknown discriminator. The message is sent back to the client verbatim.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
