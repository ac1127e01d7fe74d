package com.architecture.inventory.exception;

import lombok.Getter;

/**
 * A graph traversal or fixpoint loop went past its configured limit.
 */
@Getter
public class TraversalLimitExceededException extends RuntimeException {

    private final long limit;

    public TraversalLimitExceededException(String operation, long limit) {
        super(operation + " exceeded its limit of " + limit);
        this.limit = limit;
    }
}
