package org.carball.designer.model.design;

/**
 * A candidate design is structurally unusable and cannot be scored.
 */
public class InvalidDesignException extends IllegalArgumentException {

    public InvalidDesignException(String message) {
        super(message);
    }
}
