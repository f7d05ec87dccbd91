package dev.pekelund.menuscan.menuparser.decoding;

/**
 * Signals that an uploaded menu could not be turned into text or rows.
 */
public class MenuDecodingException extends RuntimeException {

    public MenuDecodingException(String message) {
        super(message);
    }

    public MenuDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
