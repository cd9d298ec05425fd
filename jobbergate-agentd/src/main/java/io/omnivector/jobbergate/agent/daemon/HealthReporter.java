package io.omnivector.jobbergate.agent.daemon;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.client.JobbergateApi;
import io.omnivector.jobbergate.agent.exceptions.ReportException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;

/** Tells the API that this agent is alive and how often it checks in. */
public final class HealthReporter 
 implements TaskAction
{
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(HealthReporter.class);
    
    private final JobbergateApi _api;
    private final Duration      _interval;
    
    public HealthReporter(JobbergateApi api, Duration interval)
    {
        _api = api;
        _interval = interval;
    }
    
    @Override
    public void run()
    {
        try {
            _api.reportHealth(_interval.toSeconds());
            if (_log.isDebugEnabled()) _log.debug(MsgUtils.getMsg("AGENT_HEALTH_REPORTED", _interval.toSeconds()));
        }
        catch (ReportException e) {
            _log.warn(MsgUtils.getMsg("AGENT_HEALTH_REPORT_FAILED", e.getMessage()));
        }
    }
}
