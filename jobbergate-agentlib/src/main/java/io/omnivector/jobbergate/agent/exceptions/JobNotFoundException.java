package io.omnivector.jobbergate.agent.exceptions;

/** The scheduler has no record of the requested job id, usually because
 * the job was purged from its history.  Unlike its parent this is not
 * transient: the job is reported as lost.
 */
public class JobNotFoundException 
 extends QueryException
{
    private static final long serialVersionUID = -7460117412271634455L;
    
    private final String _schedulerJobId;

    public JobNotFoundException(String schedulerJobId, String reason) 
    {
        super(reason);
        _schedulerJobId = schedulerJobId;
    }
    
    public String getSchedulerJobId() {return _schedulerJobId;}
}
