package io.omnivector.jobbergate.agent.client;

import java.util.List;

import io.omnivector.jobbergate.agent.exceptions.FetchException;
import io.omnivector.jobbergate.agent.exceptions.ReportException;
import io.omnivector.jobbergate.agent.model.ActiveJobSubmission;
import io.omnivector.jobbergate.agent.model.JobScriptFile;
import io.omnivector.jobbergate.agent.model.JobStatusUpdate;
import io.omnivector.jobbergate.agent.model.PendingJobSubmission;
import io.omnivector.jobbergate.agent.model.SchedulerJobInfo;

/** The agent's view of the remote Jobbergate API.  All report calls must be
 * idempotent on the API side: repeating a report for the same job submission
 * has no effect beyond the first.
 */
public interface JobbergateApi
{
    /** Job submissions waiting to be handed to the scheduler, in API order. */
    List<PendingJobSubmission> fetchPendingSubmissions() throws FetchException;
    
    /** Job submissions the API considers active on this cluster. */
    List<ActiveJobSubmission> fetchActiveSubmissions() throws FetchException;
    
    /** Download the text of one job script file. */
    String retrieveFile(JobScriptFile file) throws FetchException;
    
    /** Report that a submission was accepted by the scheduler.
     * 
     * @param id the job submission id
     * @param slurmJobId the scheduler assigned id
     * @param info the scheduler's initial view of the job, can be null
     */
    void markSubmitted(long id, String slurmJobId, SchedulerJobInfo info) throws ReportException;
    
    /** Report that a submission could not be handed to the scheduler. */
    void markRejected(long id, String reason) throws ReportException;
    
    /** Report the current scheduler state of an active submission. */
    void updateStatus(long id, JobStatusUpdate update) throws ReportException;
    
    /** Tell the API this agent is alive and how often to expect it. */
    void reportHealth(long intervalSeconds) throws ReportException;
}
