package io.omnivector.jobbergate.agent.reconcilers;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.client.JobbergateApi;
import io.omnivector.jobbergate.agent.exceptions.FetchException;
import io.omnivector.jobbergate.agent.exceptions.JobNotFoundException;
import io.omnivector.jobbergate.agent.exceptions.QueryException;
import io.omnivector.jobbergate.agent.exceptions.ReportException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;
import io.omnivector.jobbergate.agent.model.ActiveJobSubmission;
import io.omnivector.jobbergate.agent.model.JobStatusUpdate;
import io.omnivector.jobbergate.agent.model.ReconciliationReport;
import io.omnivector.jobbergate.agent.model.SchedulerJobInfo;
import io.omnivector.jobbergate.agent.model.enumerations.JobState;
import io.omnivector.jobbergate.agent.model.enumerations.ReconcileOutcome;
import io.omnivector.jobbergate.agent.schedulers.JobScheduler;

/** Carries the scheduler's view of active job submissions back to the API.
 * 
 * <p>Every active submission is queried and its state reported on every 
 * cycle, changed or not.  Reports are idempotent on the API side, so this 
 * delivers each terminal state at least once: a failed report is simply 
 * repeated on the next cycle.  A job the scheduler no longer knows is 
 * reported as {@link JobState#LOST}, which is terminal, so it stops being
 * polled.  Scheduler states this agent does not recognize are reported as
 * {@link JobState#UNRECOGNIZED} and logged.
 * 
 * <p>Submissions their owner cancelled are handled here too.  Without a 
 * slurm job there is nothing to cancel and the cancellation is reported
 * directly; otherwise the slurm job is cancelled and its state then flows
 * back through the normal query.
 */
public final class StatusReconciler 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(StatusReconciler.class);
    
    // Report name.
    public static final String NAME = "active-submissions";

    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    private final JobbergateApi _api;
    private final JobScheduler  _scheduler;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public StatusReconciler(JobbergateApi api, JobScheduler scheduler)
    {
        _api = api;
        _scheduler = scheduler;
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* reconcile:                                                             */
    /* ---------------------------------------------------------------------- */
    /** Run one cycle.  This method does not throw; every failure is logged
     * and counted in the returned report.
     * 
     * @return what happened during the cycle
     */
    public ReconciliationReport reconcile()
    {
        var report = new ReconciliationReport(NAME);
        
        List<ActiveJobSubmission> jobs;
        try {jobs = _api.fetchActiveSubmissions();}
            catch (FetchException e) {
                _log.error(MsgUtils.getMsg("AGENT_FETCH_ACTIVE_FAILED", e.getMessage()), e);
                report.increment(ReconcileOutcome.FETCH_FAILED);
                return report;
            }
        report.setFetched(jobs.size());
        if (_log.isDebugEnabled()) _log.debug(MsgUtils.getMsg("AGENT_FETCHED_ACTIVE", jobs.size()));
        
        for (int i = 0; i < jobs.size(); i++) {
            var job = jobs.get(i);
            if (Thread.currentThread().isInterrupted()) {
                stopInterrupted(report, jobs.size() - i);
                break;
            }
            
            try {processJob(job, report);}
                catch (InterruptedException e) {
                    // The job stays active and is queried again next cycle.
                    Thread.currentThread().interrupt();
                    stopInterrupted(report, jobs.size() - i);
                    break;
                }
                catch (Exception e) {
                    _log.error(MsgUtils.getMsg("AGENT_UNEXPECTED_JOB_ERROR", NAME, job.getId(), e.getMessage()), e);
                    report.increment(ReconcileOutcome.UNEXPECTED_ERROR);
                }
        }
        
        _log.info(report.toString());
        return report;
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* processJob:                                                            */
    /* ---------------------------------------------------------------------- */
    private void processJob(ActiveJobSubmission job, ReconciliationReport report)
     throws InterruptedException
    {
        final long id = job.getId();
        final String slurmJobId = StringUtils.trimToNull(job.getSlurmJobId());
        
        // Cancellation requests.
        if (job.isCancelRequested()) {
            if (slurmJobId == null) {
                var update = new JobStatusUpdate(JobState.CANCELLED, null, JobState.CANCELLED.name(),
                                                 MsgUtils.getMsg("AGENT_CANCELLED_BEFORE_SUBMIT"), null);
                sendUpdate(id, update, ReconcileOutcome.CANCELLED, report);
                return;
            }
            cancelJob(id, slurmJobId, report);
        }
        
        // An active job without a slurm id should not exist.
        if (slurmJobId == null) {
            _log.warn(MsgUtils.getMsg("AGENT_ACTIVE_WITHOUT_SLURM_ID", id, job.getStatus()));
            report.increment(ReconcileOutcome.QUERY_FAILED);
            return;
        }
        
        // Ask the scheduler.
        SchedulerJobInfo info;
        try {info = _scheduler.queryStatus(slurmJobId);}
            catch (JobNotFoundException e) {
                _log.warn(MsgUtils.getMsg("AGENT_JOB_LOST", id, slurmJobId, e.getReason()));
                var update = new JobStatusUpdate(JobState.LOST, slurmJobId, null, 
                                                 MsgUtils.getMsg("AGENT_LOST_REASON", slurmJobId), null);
                sendUpdate(id, update, ReconcileOutcome.LOST, report);
                return;
            }
            catch (QueryException e) {
                // Transient, the job stays active and is queried next cycle.
                _log.warn(MsgUtils.getMsg("AGENT_QUERY_FAILED", id, slurmJobId, e.getReason()));
                report.increment(ReconcileOutcome.QUERY_FAILED);
                return;
            }
        
        var update = JobStatusUpdate.fromSchedulerInfo(info);
        if (update.getStatus() == JobState.UNRECOGNIZED) {
            _log.warn(MsgUtils.getMsg("AGENT_UNRECOGNIZED_STATE", id, slurmJobId, info.getRawState()));
            report.increment(ReconcileOutcome.UNRECOGNIZED_STATE);
        }
        if (_log.isDebugEnabled()) _log.debug(MsgUtils.getMsg("AGENT_STATUS_QUERIED", id, update));
        sendUpdate(id, update, ReconcileOutcome.STATUS_REPORTED, report);
    }
    
    /* ---------------------------------------------------------------------- */
    /* cancelJob:                                                             */
    /* ---------------------------------------------------------------------- */
    /** Failures are counted but processing continues with the status query,
     * which reports the cancelled state once slurm has it.
     */
    private void cancelJob(long id, String slurmJobId, ReconciliationReport report)
     throws InterruptedException
    {
        try {_scheduler.cancel(slurmJobId);}
            catch (QueryException e) {
                _log.error(MsgUtils.getMsg("AGENT_CANCEL_FAILED", id, slurmJobId, e.getReason()));
                report.increment(ReconcileOutcome.CANCEL_FAILED);
                return;
            }
        report.increment(ReconcileOutcome.CANCEL_ISSUED);
    }
    
    /* ---------------------------------------------------------------------- */
    /* stopInterrupted:                                                       */
    /* ---------------------------------------------------------------------- */
    private void stopInterrupted(ReconciliationReport report, int remaining)
    {
        _log.warn(MsgUtils.getMsg("AGENT_CYCLE_INTERRUPTED", NAME, remaining));
        report.add(ReconcileOutcome.INTERRUPTED, remaining);
    }
    
    /* ---------------------------------------------------------------------- */
    /* sendUpdate:                                                            */
    /* ---------------------------------------------------------------------- */
    private void sendUpdate(long id, JobStatusUpdate update, ReconcileOutcome outcome,
                            ReconciliationReport report)
    {
        try {_api.updateStatus(id, update);}
            catch (ReportException e) {
                _log.error(MsgUtils.getMsg("AGENT_UPDATE_STATUS_FAILED", id, update.getStatus(), e.getMessage()), e);
                report.increment(ReconcileOutcome.REPORT_FAILED);
                return;
            }
        report.increment(outcome);
    }
}
