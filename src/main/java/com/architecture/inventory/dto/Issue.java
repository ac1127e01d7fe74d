package com.architecture.inventory.dto;

import lombok.Value;

/**
 * A single validation finding for one asset.
 */
@Value
public class Issue {

    Severity severity;
    IssueCode code;
    String message;

    public static Issue error(IssueCode code, String message) {
        return new Issue(Severity.ERROR, code, message);
    }

    public static Issue warning(IssueCode code, String message) {
        return new Issue(Severity.WARNING, code, message);
    }

    public static Issue note(IssueCode code, String message) {
        return new Issue(Severity.NOTE, code, message);
    }

    public boolean isProblem() {
        return severity != Severity.NOTE;
    }

    @Override
    public String toString() {
        return severity + ": " + message;
    }
}
