package org.dgov.db;

/**
 * A persistence failure. Distinct from governance rejections: the call did
 * not fail its rules, the storage underneath it failed.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
