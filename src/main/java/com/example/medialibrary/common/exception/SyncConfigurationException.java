package com.example.medialibrary.common.exception;

/**
 * Preferences could not be read or contradict each other. A sync never starts enumerating when
 * this is raised.
 */
public class SyncConfigurationException extends BusinessException {

    public SyncConfigurationException(String message) {
        super("SYNC_CONFIG_INVALID", message);
    }

    public SyncConfigurationException(String message, Throwable cause) {
        super("SYNC_CONFIG_INVALID", message, cause);
    }
}
