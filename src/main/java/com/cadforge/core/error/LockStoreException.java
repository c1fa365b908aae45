package com.cadforge.core.error;

import java.util.Map;

/**
 * The shared lock table could not be read or written.
 */
public class LockStoreException extends CadforgeException {

    public LockStoreException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_FAILURE, message, Map.of(), cause);
    }
}
