package io.omnivector.jobbergate.agent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.omnivector.jobbergate.agent.model.enumerations.JobState;
import io.omnivector.jobbergate.agent.model.enumerations.SlurmJobState;

/** The structured result of a scheduler status query.  The raw state is
 * kept as reported; translation to the internal state happens on demand
 * so that unrecognized states survive to the report.
 */
public final class SchedulerJobInfo 
{
    private final String _schedulerJobId;
    private final String _rawState;
    private final String _reason;
    private final Map<String,String> _fields;
    
    public SchedulerJobInfo(String schedulerJobId, String rawState, String reason,
                            Map<String,String> fields)
    {
        _schedulerJobId = schedulerJobId;
        _rawState = rawState;
        _reason = reason;
        _fields = fields == null ? Collections.emptyMap() : 
                    Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
    
    /** The internal state, never null. */
    public JobState getJobState() {return SlurmJobState.toJobState(_rawState);}
    
    /** The reason reported by the scheduler or, failing that, the default 
     * reason associated with the state.  States with a fixed reason always
     * report that reason.  Can be null.
     */
    public String getEffectiveReason()
    {
        var state = SlurmJobState.fromRaw(_rawState);
        if (state != null && state.isReasonFixed()) return state.getDefaultReason();
        if (_reason != null) return _reason;
        return state == null ? null : state.getDefaultReason();
    }
    
    public String getSchedulerJobId() {return _schedulerJobId;}
    public String getRawState() {return _rawState;}
    public String getReason() {return _reason;}
    public Map<String,String> getFields() {return _fields;}
    
    @Override
    public String toString()
    {
        return "SchedulerJobInfo[id=" + _schedulerJobId + ", state=" + _rawState + 
               ", reason=" + _reason + "]";
    }
}
