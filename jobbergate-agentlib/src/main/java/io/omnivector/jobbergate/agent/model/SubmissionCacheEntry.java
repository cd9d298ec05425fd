package io.omnivector.jobbergate.agent.model;

import java.time.Duration;
import java.time.Instant;

/** Records that a job submission was accepted by the scheduler under the 
 * given scheduler id but that the API has not yet acknowledged it.
 */
public final class SubmissionCacheEntry 
{
    private final long    _jobSubmissionId;
    private final String  _schedulerJobId;
    private final Instant _created;
    
    public SubmissionCacheEntry(long jobSubmissionId, String schedulerJobId, Instant created)
    {
        _jobSubmissionId = jobSubmissionId;
        _schedulerJobId = schedulerJobId;
        _created = created;
    }
    
    public boolean isExpired(Instant now, Duration ttl) {return !now.isBefore(_created.plus(ttl));}
    
    public long getJobSubmissionId() {return _jobSubmissionId;}
    public String getSchedulerJobId() {return _schedulerJobId;}
    public Instant getCreated() {return _created;}
}
