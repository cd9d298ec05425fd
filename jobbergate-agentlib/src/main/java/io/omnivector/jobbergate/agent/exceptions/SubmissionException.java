package io.omnivector.jobbergate.agent.exceptions;

/** A pending job could not be handed to the scheduler.  The reason text
 * is sent to the API verbatim as the rejection message, so it should be
 * readable by the job's owner.
 */
public class SubmissionException 
 extends AgentException
{
    private static final long serialVersionUID = -5209834411632468221L;

    public SubmissionException(String reason) {super(reason);}
    public SubmissionException(String reason, Throwable cause) {super(reason, cause);}
    
    public String getReason() {return getMessage();}
}
