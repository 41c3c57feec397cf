package org.carball.designer.stats;

import lombok.Getter;

/**
 * An operation or design names a collection that has no statistics, meaning the
 * trace and the sampled dataset do not describe the same database.
 */
@Getter
public class UnknownCollectionException extends RuntimeException {

    private final String collection;

    public UnknownCollectionException(String collection) {
        super("Unknown collection '" + collection + "': no statistics were collected for it");
        this.collection = collection;
    }
}
