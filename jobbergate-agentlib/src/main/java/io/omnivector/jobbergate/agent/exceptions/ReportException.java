package io.omnivector.jobbergate.agent.exceptions;

/** The remote API refused or did not acknowledge a report about a job. */
public class ReportException 
 extends AgentException
{
    private static final long serialVersionUID = 6157360823014585197L;

    public ReportException(String message) {super(message);}
    public ReportException(String message, Throwable cause) {super(message, cause);}
}
