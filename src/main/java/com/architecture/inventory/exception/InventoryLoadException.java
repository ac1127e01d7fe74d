package com.architecture.inventory.exception;

/**
 * An asset file or type registry file could not be read or has the wrong shape.
 */
public class InventoryLoadException extends RuntimeException {

    public InventoryLoadException(String message) {
        super(message);
    }

    public InventoryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
