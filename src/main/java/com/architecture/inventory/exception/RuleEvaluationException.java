package com.architecture.inventory.exception;

import com.architecture.inventory.dto.ValidationReport;
import lombok.Getter;

/**
 * A validation rule failed unexpectedly. The partial report, including the
 * failing asset's issues up to the failure, travels with the exception.
 */
@Getter
public class RuleEvaluationException extends RuntimeException {

    private final String assetId;
    private final transient ValidationReport partialReport;

    public RuleEvaluationException(String assetId, ValidationReport partialReport, Throwable cause) {
        super("Validation failed for asset " + assetId + ": " + cause.getMessage(), cause);
        this.assetId = assetId;
        this.partialReport = partialReport;
    }
}
