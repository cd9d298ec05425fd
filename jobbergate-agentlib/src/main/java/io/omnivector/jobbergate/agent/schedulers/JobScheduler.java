package io.omnivector.jobbergate.agent.schedulers;

import java.nio.file.Path;
import java.util.List;

import io.omnivector.jobbergate.agent.exceptions.JobNotFoundException;
import io.omnivector.jobbergate.agent.exceptions.QueryException;
import io.omnivector.jobbergate.agent.exceptions.SubmissionException;
import io.omnivector.jobbergate.agent.model.SchedulerJobInfo;

/** The agent's only view of the batch scheduler.  Implementations must bound
 * every call in time and must never pass user supplied text through a shell.
 */
public interface JobScheduler
{
    /** Submit a batch script.
     * 
     * @param script absolute path of the entrypoint script
     * @param directives extra command line options, placed before the script 
     * @param workDir directory the job runs in
     * @return the scheduler assigned job id
     * @throws SubmissionException on any failure, with an owner readable reason
     * @throws InterruptedException if the calling thread was interrupted, in
     *                              which case the job may or may not have
     *                              been accepted
     */
    String submit(Path script, List<String> directives, Path workDir) 
     throws SubmissionException, InterruptedException;

    /** Query the current status of a job.
     * 
     * @throws JobNotFoundException when the scheduler has no record of the id
     * @throws QueryException on any other, possibly transient, failure
     * @throws InterruptedException if the calling thread was interrupted
     */
    SchedulerJobInfo queryStatus(String schedulerJobId) throws QueryException, InterruptedException;

    /** Ask the scheduler to cancel a job. */
    void cancel(String schedulerJobId) throws QueryException, InterruptedException;
}
