package io.omnivector.jobbergate.agent.model.enumerations;

/** The outcomes counted in a reconciliation report. */
public enum ReconcileOutcome 
{
    // Submission reconciler.
    SUBMITTED,
    REJECTED,
    REPORT_RETRIED,
    
    // Status reconciler.
    STATUS_REPORTED,
    LOST,
    QUERY_FAILED,
    UNRECOGNIZED_STATE,
    CANCEL_ISSUED,
    CANCEL_FAILED,
    CANCELLED,
    
    // Both.
    REPORT_FAILED,
    FETCH_FAILED,
    UNEXPECTED_ERROR,
    INTERRUPTED
}
