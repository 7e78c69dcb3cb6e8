package com.inflationdata.ipc.exception;

/**
 * Structural failure of a load run: a source whose shape cannot be trusted,
 * an unreachable endpoint, or a failed batch write. Aborts the run.
 */
public class IpcLoadException extends RuntimeException {

    public IpcLoadException(String message) {
        super(message);
    }

    public IpcLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
