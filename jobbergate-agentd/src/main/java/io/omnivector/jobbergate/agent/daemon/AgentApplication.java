package io.omnivector.jobbergate.agent.daemon;

import java.io.IOException;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.client.JobbergateApi;
import io.omnivector.jobbergate.agent.client.JobbergateApiClient;
import io.omnivector.jobbergate.agent.config.RuntimeParameters;
import io.omnivector.jobbergate.agent.exceptions.AgentException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;
import io.omnivector.jobbergate.agent.process.LocalCommandRunner;
import io.omnivector.jobbergate.agent.reconcilers.JobFileManager;
import io.omnivector.jobbergate.agent.reconcilers.StatusReconciler;
import io.omnivector.jobbergate.agent.reconcilers.SubmissionCache;
import io.omnivector.jobbergate.agent.reconcilers.SubmissionReconciler;
import io.omnivector.jobbergate.agent.schedulers.JobScheduler;
import io.omnivector.jobbergate.agent.schedulers.SlurmScheduler;
import io.omnivector.jobbergate.agent.usermapper.SingleUserMapper;

/** The agent daemon's entry point.  Configuration comes from the agent 
 * properties file and the environment; see {@link RuntimeParameters}.
 */
public final class AgentApplication 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(AgentApplication.class);
    
    // Task names.
    public static final String HEALTH_TASK_NAME = "health-report";
    
    // Exit code on startup failure.
    private static final int STARTUP_FAILURE_RC = 1;
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private AgentApplication() {}
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* main:                                                                  */
    /* ---------------------------------------------------------------------- */
    public static void main(String[] args) 
    {
        // Bad configuration ends the process.
        RuntimeParameters parms;
        try {parms = RuntimeParameters.load();}
            catch (AgentException e) {
                _log.error(MsgUtils.getMsg("AGENT_STARTUP_FAILED", e.getMessage()), e);
                System.exit(STARTUP_FAILURE_RC);
                return;
            }
        _log.info(MsgUtils.getMsg("AGENT_STARTING", parms));
        checkSubmitterAccount(parms.getSingleUserSubmitter(), System.getProperty("user.name"));
        
        // Wire the components together.
        var apiClient = new JobbergateApiClient(parms);
        var slurm = new SlurmScheduler(parms, new LocalCommandRunner());
        var taskScheduler = new AgentTaskScheduler(createTasks(parms, apiClient, slurm));
        
        // The hook lets runs in progress finish before the JVM exits.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            taskScheduler.shutdown(parms.getShutdownGracePeriod());
            closeClient(apiClient);
            _log.info(MsgUtils.getMsg("AGENT_SHUTDOWN_COMPLETE"));
        }, "AgentShutdownHook"));
        
        taskScheduler.start();
        _log.info(MsgUtils.getMsg("AGENT_STARTED", taskScheduler.getTasks().size()));
        
        try {taskScheduler.awaitTermination();}
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                taskScheduler.shutdown(parms.getShutdownGracePeriod());
            }
    }
    
    /* ---------------------------------------------------------------------- */
    /* checkSubmitterAccount:                                                 */
    /* ---------------------------------------------------------------------- */
    /** Jobs are always submitted by the account the JVM runs as; the mapped 
     * user name only selects the default working directory.
     * 
     * @param submitter the configured single user submitter
     * @param processUser the account running this process
     * @return true if the accounts match
     */
    public static boolean checkSubmitterAccount(String submitter, String processUser)
    {
        if (StringUtils.equals(submitter, processUser)) return true;
        _log.warn(MsgUtils.getMsg("AGENT_SUBMITTER_ACCOUNT_MISMATCH", submitter, processUser));
        return false;
    }
    
    /* ---------------------------------------------------------------------- */
    /* createTasks:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Build the agent's recurring tasks around the given collaborators.
     * 
     * @param parms the runtime configuration
     * @param api the jobbergate api
     * @param scheduler the batch scheduler
     * @return the tasks in start order
     */
    public static List<ScheduledTask> createTasks(RuntimeParameters parms, JobbergateApi api, 
                                                  JobScheduler scheduler)
    {
        var submissions = new SubmissionReconciler(api, scheduler, 
                                new SingleUserMapper(parms.getSingleUserSubmitter()),
                                new JobFileManager(api, parms), 
                                new SubmissionCache(parms.getSubmissionCacheTtl()));
        var statuses = new StatusReconciler(api, scheduler);
        var health = new HealthReporter(api, parms.getHealthInterval());
        
        return List.of(
            new ScheduledTask(SubmissionReconciler.NAME, parms.getSubmissionsInterval(), submissions::reconcile),
            new ScheduledTask(StatusReconciler.NAME, parms.getStatusInterval(), statuses::reconcile),
            new ScheduledTask(HEALTH_TASK_NAME, parms.getHealthInterval(), health));
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* closeClient:                                                           */
    /* ---------------------------------------------------------------------- */
    private static void closeClient(JobbergateApiClient client)
    {
        try {client.close();}
            catch (IOException e) {
                _log.warn(MsgUtils.getMsg("AGENT_CLIENT_CLOSE_ERROR", e.getMessage()));
            }
    }
}
