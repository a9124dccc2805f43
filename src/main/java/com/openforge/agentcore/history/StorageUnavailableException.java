package com.openforge.agentcore.history;

/**
 * The history backend could not be reached or refused a read or write.
 * Aborts the current turn; nothing partial is written after it.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
