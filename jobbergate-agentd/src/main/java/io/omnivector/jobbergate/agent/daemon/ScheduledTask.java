package io.omnivector.jobbergate.agent.daemon;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.i18n.MsgUtils;

/** A named unit of recurring work.  A run never overlaps an earlier run of
 * the same task: a run that finds its predecessor still in progress is 
 * skipped.  Nothing thrown by the action escapes {@link #run()}, so an 
 * executor never cancels the task's future runs because of a failure.
 */
public final class ScheduledTask 
 implements Runnable
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(ScheduledTask.class);

    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    private final String     _name;
    private final Duration   _interval;
    private final TaskAction _action;
    
    // Run bookkeeping.
    private final AtomicBoolean _running = new AtomicBoolean();
    private final AtomicLong    _runCount = new AtomicLong();
    private final AtomicLong    _skipCount = new AtomicLong();
    private final AtomicLong    _failureCount = new AtomicLong();
    private volatile Instant    _lastStart;
    private volatile Instant    _lastEnd;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public ScheduledTask(String name, Duration interval, TaskAction action)
    {
        _name = name;
        _interval = interval;
        _action = action;
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* run:                                                                   */
    /* ---------------------------------------------------------------------- */
    @Override
    public void run()
    {
        if (!_running.compareAndSet(false, true)) {
            _skipCount.incrementAndGet();
            _log.warn(MsgUtils.getMsg("AGENT_TASK_SKIPPED_OVERLAP", _name, _lastStart));
            return;
        }
        
        Instant start = Instant.now();
        _lastStart = start;
        long runNumber = _runCount.incrementAndGet();
        try {
            _action.run();
            if (_log.isDebugEnabled())
                _log.debug(MsgUtils.getMsg("AGENT_TASK_RUN_COMPLETE", _name, runNumber, 
                                           Duration.between(start, Instant.now()).toMillis()));
        }
        catch (Exception e) {
            _failureCount.incrementAndGet();
            _log.error(MsgUtils.getMsg("AGENT_TASK_FAILED", _name, e.getMessage()), e);
        }
        finally {
            _lastEnd = Instant.now();
            _running.set(false);
        }
    }
    
    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public String getName() {return _name;}
    public Duration getInterval() {return _interval;}
    public boolean isRunning() {return _running.get();}
    public long getRunCount() {return _runCount.get();}
    public long getSkipCount() {return _skipCount.get();}
    public long getFailureCount() {return _failureCount.get();}
    public Instant getLastStart() {return _lastStart;}
    public Instant getLastEnd() {return _lastEnd;}
}
