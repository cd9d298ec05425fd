package io.omnivector.jobbergate.agent.reconcilers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.i18n.MsgUtils;
import io.omnivector.jobbergate.agent.model.SubmissionCacheEntry;

/** Remembers scheduler ids of submissions the API has not yet acknowledged.
 * An entry lives from the moment the scheduler accepts a job until the 
 * submitted report succeeds or the entry's time-to-live runs out, whichever
 * comes first.  Nothing is persisted: the cache is empty after a restart.
 * 
 * <p>The owning reconciler is the only writer, but the map is concurrent so
 * that the cache can be inspected from other threads.
 */
public final class SubmissionCache 
{
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(SubmissionCache.class);
    
    private final Duration _ttl;
    private final Clock    _clock;
    private final ConcurrentHashMap<Long,SubmissionCacheEntry> _entries = new ConcurrentHashMap<>();
    
    public SubmissionCache(Duration ttl) {this(ttl, Clock.systemUTC());}
    
    public SubmissionCache(Duration ttl, Clock clock)
    {
        if (ttl == null || ttl.isNegative() || ttl.isZero())
            throw new IllegalArgumentException(MsgUtils.getMsg("AGENT_NULL_PARAMETER", "SubmissionCache", "ttl"));
        _ttl = ttl;
        _clock = clock;
    }
    
    /** Record a scheduler id for a job submission, replacing any earlier entry. */
    public void put(long jobSubmissionId, String schedulerJobId)
    {
        _entries.put(jobSubmissionId, new SubmissionCacheEntry(jobSubmissionId, schedulerJobId, _clock.instant()));
    }
    
    /** Get the cached scheduler id, or null if there is none or it has expired.
     * Expired entries are evicted on the way.
     */
    public String get(long jobSubmissionId)
    {
        var entry = _entries.get(jobSubmissionId);
        if (entry == null) return null;
        if (entry.isExpired(_clock.instant(), _ttl)) {
            if (_entries.remove(jobSubmissionId, entry))
                _log.warn(MsgUtils.getMsg("AGENT_CACHE_EXPIRED", jobSubmissionId, entry.getSchedulerJobId(), 
                                          entry.getCreated()));
            return null;
        }
        return entry.getSchedulerJobId();
    }
    
    /** Evict the entry for a job submission. */
    public void remove(long jobSubmissionId) {_entries.remove(jobSubmissionId);}
    
    public boolean contains(long jobSubmissionId) {return get(jobSubmissionId) != null;}
    
    /** Evict every expired entry.
     * 
     * @return the number of entries evicted
     */
    public int purgeExpired()
    {
        var now = _clock.instant();
        int evicted = 0;
        for (var entry : _entries.values()) 
            if (entry.isExpired(now, _ttl) && _entries.remove(entry.getJobSubmissionId(), entry)) {
                _log.warn(MsgUtils.getMsg("AGENT_CACHE_EXPIRED", entry.getJobSubmissionId(), 
                                          entry.getSchedulerJobId(), entry.getCreated()));
                evicted++;
            }
        return evicted;
    }
    
    public int size() {return _entries.size();}
    public Duration getTtl() {return _ttl;}
}
