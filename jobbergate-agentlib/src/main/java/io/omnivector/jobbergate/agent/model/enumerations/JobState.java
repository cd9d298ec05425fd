package io.omnivector.jobbergate.agent.model.enumerations;

/** The agent's scheduler-independent view of a submitted job.  Raw scheduler
 * states are translated into these values before being reported upstream.
 * Terminal states are those after which the job is expected to leave the 
 * active set on the API side.
 * 
 * LOST and UNRECOGNIZED are both "unknown" conditions but differ in an 
 * important way: LOST means the scheduler has no record of the job, so 
 * polling it further is pointless; UNRECOGNIZED means the scheduler reported
 * a state this agent does not know, so polling continues.
 */
public enum JobState 
{
    QUEUED("Job is waiting in the scheduler queue", false),
    RUNNING("Job is executing", false),
    COMPLETED("Job completed normally", true),
    FAILED("Job terminated abnormally", true),
    CANCELLED("Job was cancelled", true),
    LOST("Scheduler has no record of the job", true),
    UNRECOGNIZED("Scheduler reported an unrecognized state", false);
    
    // ---- Fields
    private final String  _description;
    private final boolean _terminal;
    
    // ---- Constructor
    JobState(String description, boolean terminal)
    {
        _description = description;
        _terminal = terminal;
    }
    
    // ---- Instance Methods
    public String getDescription() {return _description;}
    public boolean isTerminal() {return _terminal;}
}
