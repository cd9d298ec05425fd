package io.omnivector.jobbergate.agent.exceptions;

/** The remote API could not be reached or answered a list/file request
 * with a non-success status.  A fetch failure ends the reconciliation
 * cycle; the next scheduled cycle retries.
 */
public class FetchException 
 extends AgentException
{
    private static final long serialVersionUID = -2393166414452861066L;

    public FetchException(String message) {super(message);}
    public FetchException(String message, Throwable cause) {super(message, cause);}
}
