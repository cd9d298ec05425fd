package io.omnivector.jobbergate.agent.model.enumerations;

/** Job submission statuses as recorded by the Jobbergate API. */
public enum JobSubmissionStatus 
{
    CREATED,
    SUBMITTED,
    REJECTED,
    DONE,
    ABORTED,
    CANCELLED
}
