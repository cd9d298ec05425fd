package io.omnivector.jobbergate.agent.model;

import java.util.EnumMap;
import java.util.Map;

import io.omnivector.jobbergate.agent.model.enumerations.ReconcileOutcome;

/** Counts what happened during one reconciliation cycle.  Instances are 
 * filled in by a single reconciler run and then only read.
 */
public final class ReconciliationReport 
{
    // The reconciler that produced this report.
    private final String _name;
    private final Map<ReconcileOutcome,Integer> _counts = new EnumMap<>(ReconcileOutcome.class);
    
    // Number of jobs retrieved from the api.
    private int _fetched;
    
    public ReconciliationReport(String name) {_name = name;}
    
    public void increment(ReconcileOutcome outcome) {add(outcome, 1);}
    public void add(ReconcileOutcome outcome, int count) {_counts.merge(outcome, count, Integer::sum);}
    public int getCount(ReconcileOutcome outcome) {return _counts.getOrDefault(outcome, 0);}
    
    public boolean isFetchFailed() {return getCount(ReconcileOutcome.FETCH_FAILED) > 0;}
    
    public String getName() {return _name;}
    public int getFetched() {return _fetched;}
    public void setFetched(int fetched) {_fetched = fetched;}
    
    @Override
    public String toString()
    {
        var buf = new StringBuilder(128);
        buf.append(_name).append(": fetched=").append(_fetched);
        for (var entry : _counts.entrySet())
            buf.append(", ").append(entry.getKey().name().toLowerCase()).append("=").append(entry.getValue());
        return buf.toString();
    }
}
