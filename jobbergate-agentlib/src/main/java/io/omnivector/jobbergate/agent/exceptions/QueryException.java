package io.omnivector.jobbergate.agent.exceptions;

/** A scheduler status or cancel command failed for a reason that may clear
 * up on its own, such as a timeout or unparseable output.  The job stays
 * active and is queried again on the next cycle.
 */
public class QueryException 
 extends AgentException
{
    private static final long serialVersionUID = 1903467262818040021L;

    public QueryException(String reason) {super(reason);}
    public QueryException(String reason, Throwable cause) {super(reason, cause);}
    
    public String getReason() {return getMessage();}
}
