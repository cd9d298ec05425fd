package io.omnivector.jobbergate.agent.daemon;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.i18n.MsgUtils;

/** Drives the agent's scheduled tasks.  Each task is run with a fixed delay
 * between the end of one run and the start of the next, and there is one 
 * thread per task so that a slow task never delays another.
 */
public final class AgentTaskScheduler 
 implements Thread.UncaughtExceptionHandler
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(AgentTaskScheduler.class);
    
    // Thread names.
    private static final String THREADGROUP_NAME   = "AgentTaskGroup";
    private static final String THREAD_NAME_PREFIX = "AgentTask-";

    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    private final List<ScheduledTask>          _tasks;
    private final ScheduledThreadPoolExecutor _executor;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public AgentTaskScheduler(List<ScheduledTask> tasks)
    {
        _tasks = List.copyOf(tasks);
        _executor = new ScheduledThreadPoolExecutor(Math.max(1, _tasks.size()), new TaskThreadFactory(this));
        _executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        _executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* start:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Schedule every task.  The first run of each task starts immediately. */
    public void start()
    {
        for (var task : _tasks) {
            long millis = task.getInterval().toMillis();
            _executor.scheduleWithFixedDelay(task, 0, millis, TimeUnit.MILLISECONDS);
            _log.info(MsgUtils.getMsg("AGENT_TASK_SCHEDULED", task.getName(), task.getInterval().toSeconds()));
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* shutdown:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Stop scheduling runs and let runs in progress finish, interrupting any
     * still running when the grace period expires.
     * 
     * @param grace the time to wait for runs in progress
     * @return true if all runs finished within the grace period
     */
    public boolean shutdown(Duration grace)
    {
        _log.info(MsgUtils.getMsg("AGENT_SHUTDOWN_REQUESTED", grace.toSeconds()));
        _executor.shutdown();
        try {
            if (_executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        
        _log.warn(MsgUtils.getMsg("AGENT_SHUTDOWN_TIMEOUT", grace.toSeconds()));
        _executor.shutdownNow();
        return false;
    }
    
    /* ---------------------------------------------------------------------- */
    /* awaitTermination:                                                      */
    /* ---------------------------------------------------------------------- */
    /** Block until the scheduler has been shut down and all runs are over. */
    public void awaitTermination() throws InterruptedException
    {
        while (!_executor.awaitTermination(1, TimeUnit.HOURS)) {}
    }
    
    /* ---------------------------------------------------------------------- */
    /* uncaughtException:                                                     */
    /* ---------------------------------------------------------------------- */
    /** Tasks catch their own exceptions, so this only records errors. */
    @Override
    public void uncaughtException(Thread t, Throwable e) 
    {
        _log.error(MsgUtils.getMsg("AGENT_THREAD_UNCAUGHT_EXCEPTION", t.getName(), e.toString()), e);
    }
    
    public List<ScheduledTask> getTasks() {return _tasks;}
    public boolean isShutdown() {return _executor.isShutdown();}
    
    /* ********************************************************************** */
    /*                         TaskThreadFactory Class                        */
    /* ********************************************************************** */
    /** Named, non-daemon threads so the JVM stays up while tasks run. */
    private static final class TaskThreadFactory implements ThreadFactory
    {
        private final ThreadGroup   _group = new ThreadGroup(THREADGROUP_NAME);
        private final AtomicInteger _threadNum = new AtomicInteger();
        private final Thread.UncaughtExceptionHandler _handler;
        
        private TaskThreadFactory(Thread.UncaughtExceptionHandler handler) {_handler = handler;}
        
        @Override
        public Thread newThread(Runnable r)
        {
            var t = new Thread(_group, r, THREAD_NAME_PREFIX + _threadNum.incrementAndGet());
            t.setDaemon(false);
            t.setUncaughtExceptionHandler(_handler);
            return t;
        }
    }
}
