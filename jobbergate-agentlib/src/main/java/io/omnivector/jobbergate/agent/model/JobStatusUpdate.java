package io.omnivector.jobbergate.agent.model;

import java.util.Map;

import io.omnivector.jobbergate.agent.model.enumerations.JobState;

/** The content of a status report for an active job submission. */
public final class JobStatusUpdate 
{
    private final JobState _status;
    private final String   _slurmJobId;
    private final String   _slurmJobState;
    private final String   _slurmJobStateReason;
    private final Map<String,String> _slurmJobInfo;
    
    public JobStatusUpdate(JobState status, String slurmJobId, String slurmJobState,
                           String slurmJobStateReason, Map<String,String> slurmJobInfo)
    {
        _status = status;
        _slurmJobId = slurmJobId;
        _slurmJobState = slurmJobState;
        _slurmJobStateReason = slurmJobStateReason;
        _slurmJobInfo = slurmJobInfo;
    }
    
    /** Build an update from the result of a scheduler query. */
    public static JobStatusUpdate fromSchedulerInfo(SchedulerJobInfo info)
    {
        return new JobStatusUpdate(info.getJobState(), info.getSchedulerJobId(), info.getRawState(),
                                   info.getEffectiveReason(), info.getFields());
    }
    
    public JobState getStatus() {return _status;}
    public String getSlurmJobId() {return _slurmJobId;}
    public String getSlurmJobState() {return _slurmJobState;}
    public String getSlurmJobStateReason() {return _slurmJobStateReason;}
    public Map<String,String> getSlurmJobInfo() {return _slurmJobInfo;}
    
    @Override
    public String toString()
    {
        return "JobStatusUpdate[status=" + _status + ", slurmJobId=" + _slurmJobId + 
               ", slurmJobState=" + _slurmJobState + ", reason=" + _slurmJobStateReason + "]";
    }
}
