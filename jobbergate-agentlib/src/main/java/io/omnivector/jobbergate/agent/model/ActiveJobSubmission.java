package io.omnivector.jobbergate.agent.model;

import io.omnivector.jobbergate.agent.model.enumerations.JobSubmissionStatus;

/** A job submission the API considers active: it either has a scheduler 
 * job id and has not reached a terminal state, or it was cancelled by its
 * owner and still needs the cancellation carried out.
 */
public class ActiveJobSubmission 
{
    private long    id;
    private String  slurmJobId;
    private JobSubmissionStatus status;
    
    // Last values the API recorded, informational only.
    private String  slurmJobState;
    private String  slurmJobStateReason;
    
    // Constructors.
    public ActiveJobSubmission() {}
    public ActiveJobSubmission(long id, String slurmJobId)
    {
        this.id = id;
        this.slurmJobId = slurmJobId;
        this.status = JobSubmissionStatus.SUBMITTED;
    }
    
    public boolean isCancelRequested() {return status == JobSubmissionStatus.CANCELLED;}
    
    // Accessors
    public long getId() {
        return id;
    }
    public void setId(long id) {
        this.id = id;
    }
    public String getSlurmJobId() {
        return slurmJobId;
    }
    public void setSlurmJobId(String slurmJobId) {
        this.slurmJobId = slurmJobId;
    }
    public JobSubmissionStatus getStatus() {
        return status;
    }
    public void setStatus(JobSubmissionStatus status) {
        this.status = status;
    }
    public String getSlurmJobState() {
        return slurmJobState;
    }
    public void setSlurmJobState(String slurmJobState) {
        this.slurmJobState = slurmJobState;
    }
    public String getSlurmJobStateReason() {
        return slurmJobStateReason;
    }
    public void setSlurmJobStateReason(String slurmJobStateReason) {
        this.slurmJobStateReason = slurmJobStateReason;
    }
}
