package org.pywalrus;

public class WalrusException extends RuntimeException {

    public WalrusException(String message) {
        super(message);
    }

    public WalrusException(String message, Throwable cause) {
        super(message, cause);
    }

    public WalrusException(Throwable cause) {
        super(cause);
    }
}
