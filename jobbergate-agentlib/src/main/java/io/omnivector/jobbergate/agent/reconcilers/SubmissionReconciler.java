package io.omnivector.jobbergate.agent.reconcilers;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.client.JobbergateApi;
import io.omnivector.jobbergate.agent.exceptions.FetchException;
import io.omnivector.jobbergate.agent.exceptions.QueryException;
import io.omnivector.jobbergate.agent.exceptions.ReportException;
import io.omnivector.jobbergate.agent.exceptions.SubmissionException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;
import io.omnivector.jobbergate.agent.model.PendingJobSubmission;
import io.omnivector.jobbergate.agent.model.ReconciliationReport;
import io.omnivector.jobbergate.agent.model.SchedulerJobInfo;
import io.omnivector.jobbergate.agent.model.enumerations.ReconcileOutcome;
import io.omnivector.jobbergate.agent.schedulers.JobScheduler;
import io.omnivector.jobbergate.agent.usermapper.UserMapper;
import io.omnivector.jobbergate.agent.usermapper.UserMappingException;

/** Hands pending job submissions to the scheduler and reports the result.
 * 
 * <p>Each pending submission is handled on its own: a failure with one never
 * stops the others.  A submission the scheduler refuses is reported as 
 * rejected and not retried.  A submission the scheduler accepts is recorded
 * in the submission cache until the API acknowledges it, so a failed 
 * submitted report is retried on the next cycle without submitting the job
 * a second time.  Only a restart, or an entry outliving the cache's 
 * time-to-live, can lead to a second submission of the same job.
 * 
 * <p>Interruption stops the cycle.  The job in progress and all jobs after
 * it are left pending and picked up again by the next cycle; interruption 
 * never leads to a rejection.
 * 
 * <p>Instances are not meant to be run concurrently with themselves; the 
 * task driver guarantees that.
 */
public final class SubmissionReconciler 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(SubmissionReconciler.class);
    
    // Report name.
    public static final String NAME = "pending-submissions";

    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    private final JobbergateApi   _api;
    private final JobScheduler    _scheduler;
    private final UserMapper      _userMapper;
    private final JobFileManager  _fileManager;
    private final SubmissionCache _cache;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public SubmissionReconciler(JobbergateApi api, JobScheduler scheduler, UserMapper userMapper,
                                JobFileManager fileManager, SubmissionCache cache)
    {
        _api = api;
        _scheduler = scheduler;
        _userMapper = userMapper;
        _fileManager = fileManager;
        _cache = cache;
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
        
        // Nothing to do if we can't get the list.
        List<PendingJobSubmission> jobs;
        try {jobs = _api.fetchPendingSubmissions();}
            catch (FetchException e) {
                _log.error(MsgUtils.getMsg("AGENT_FETCH_PENDING_FAILED", e.getMessage()), e);
                report.increment(ReconcileOutcome.FETCH_FAILED);
                return report;
            }
        report.setFetched(jobs.size());
        if (_log.isDebugEnabled()) _log.debug(MsgUtils.getMsg("AGENT_FETCHED_PENDING", jobs.size()));
        
        // Entries that expired without a matching pending job would otherwise linger.
        _cache.purgeExpired();
        
        for (int i = 0; i < jobs.size(); i++) {
            var job = jobs.get(i);
            if (Thread.currentThread().isInterrupted()) {
                stopInterrupted(report, jobs.size() - i);
                break;
            }
            
            try {processJob(job, report);}
                catch (InterruptedException e) {
                    // Leave the job pending.  If sbatch accepted it before 
                    // being killed, a duplicate submission is possible.
                    Thread.currentThread().interrupt();
                    _log.warn(MsgUtils.getMsg("AGENT_SUBMIT_INTERRUPTED", job.getId()));
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
    private void processJob(PendingJobSubmission job, ReconciliationReport report)
     throws InterruptedException
    {
        final long id = job.getId();
        
        // A cached id means the job was already submitted and only the
        // report is outstanding.
        String slurmJobId = _cache.get(id);
        boolean retry = slurmJobId != null;
        if (retry) {
            _log.info(MsgUtils.getMsg("AGENT_REPORT_RETRY", id, slurmJobId));
        } else {
            try {slurmJobId = submitJob(job);}
                catch (SubmissionException e) {
                    _log.error(MsgUtils.getMsg("AGENT_SUBMISSION_REJECTED", id, e.getReason()));
                    reject(id, e.getReason(), report);
                    return;
                }
            _cache.put(id, slurmJobId);
            _log.info(MsgUtils.getMsg("AGENT_JOB_SUBMITTED", id, slurmJobId));
        }
        
        // Report, keeping the cache entry if that fails.
        SchedulerJobInfo info = queryInitialStatus(id, slurmJobId);
        try {_api.markSubmitted(id, slurmJobId, info);}
            catch (ReportException e) {
                _log.error(MsgUtils.getMsg("AGENT_MARK_SUBMITTED_FAILED", id, slurmJobId, e.getMessage()), e);
                report.increment(ReconcileOutcome.REPORT_FAILED);
                return;
            }
        _cache.remove(id);
        report.increment(retry ? ReconcileOutcome.REPORT_RETRIED : ReconcileOutcome.SUBMITTED);
    }
    
    /* ---------------------------------------------------------------------- */
    /* submitJob:                                                             */
    /* ---------------------------------------------------------------------- */
    /** Resolve the user and directory, stage the files and call sbatch. */
    private String submitJob(PendingJobSubmission job) throws SubmissionException, InterruptedException
    {
        String username;
        try {username = _userMapper.getUsername(job.getOwnerEmail());}
            catch (UserMappingException e) {
                throw new SubmissionException(MsgUtils.getMsg("AGENT_USERNAME_UNRESOLVED"), e);
            }
        
        Path workDir = _fileManager.resolveWorkDir(job, username);
        try (var staged = _fileManager.stage(job, workDir)) {
            try {return _scheduler.submit(staged.getScriptPath(), job.getSbatchArguments(), workDir);}
                catch (SubmissionException e) {
                    throw new SubmissionException(MsgUtils.getMsg("AGENT_SUBMIT_FAILED", e.getReason()), e);
                }
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* queryInitialStatus:                                                    */
    /* ---------------------------------------------------------------------- */
    /** Best effort: the submitted report goes out without state on failure.
     * The job is already in slurm, so an interrupt here still lets the 
     * report go out before the cycle stops.
     */
    private SchedulerJobInfo queryInitialStatus(long id, String slurmJobId)
    {
        try {return _scheduler.queryStatus(slurmJobId);}
            catch (QueryException e) {
                _log.warn(MsgUtils.getMsg("AGENT_INITIAL_QUERY_FAILED", id, slurmJobId, e.getReason()));
                return null;
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                _log.warn(MsgUtils.getMsg("AGENT_INITIAL_QUERY_FAILED", id, slurmJobId, e.toString()));
                return null;
            }
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
    /* reject:                                                                */
    /* ---------------------------------------------------------------------- */
    private void reject(long id, String reason, ReconciliationReport report)
    {
        try {_api.markRejected(id, reason);}
            catch (ReportException e) {
                _log.error(MsgUtils.getMsg("AGENT_MARK_REJECTED_FAILED", id, e.getMessage()), e);
                report.increment(ReconcileOutcome.REPORT_FAILED);
                return;
            }
        report.increment(ReconcileOutcome.REJECTED);
    }
}
