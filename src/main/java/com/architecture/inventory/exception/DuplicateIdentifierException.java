package com.architecture.inventory.exception;

import lombok.Getter;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when two assets share an id. Identity-based indexing is ambiguous
 * from then on, so the run stops before any validation.
 */
@Getter
public class DuplicateIdentifierException extends RuntimeException {

    private final List<Duplicate> duplicates;

    public DuplicateIdentifierException(List<Duplicate> duplicates) {
        super("Can't continue with duplicate IDs present: " + duplicates.stream()
                .map(Duplicate::toString)
                .collect(Collectors.joining("; ")));
        this.duplicates = List.copyOf(duplicates);
    }

    @Value
    public static class Duplicate {
        String id;
        String firstSource;
        String duplicateSource;

        @Override
        public String toString() {
            return id + " (first used in " + firstSource + ", duplicated in " + duplicateSource + ")";
        }
    }
}
