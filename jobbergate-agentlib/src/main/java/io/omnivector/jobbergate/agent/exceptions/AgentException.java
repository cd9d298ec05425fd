package io.omnivector.jobbergate.agent.exceptions;

/** Root of the agent's checked exception hierarchy.  Subclasses identify
 * which reconciliation step failed so that callers can decide whether the
 * failure ends the current cycle or only the current job.
 */
public class AgentException 
 extends Exception
{
    private static final long serialVersionUID = 4781527736264215380L;

    public AgentException(String message) {super(message);}
    public AgentException(String message, Throwable cause) {super(message, cause);}
}
