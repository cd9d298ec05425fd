package io.omnivector.jobbergate.agent.reconcilers;

import java.time.Duration;
import java.time.Instant;

import org.testng.Assert;
import org.testng.annotations.Test;

import io.omnivector.jobbergate.agent.testutils.MutableClock;

@Test(groups={"unit"})
public class SubmissionCacheTest 
{
    @Test
    public void putGetRemove()
    {
        var cache = new SubmissionCache(Duration.ofMinutes(10), new MutableClock(Instant.EPOCH));
        Assert.assertNull(cache.get(1));
        cache.put(1, "1001");
        Assert.assertEquals(cache.get(1), "1001");
        Assert.assertEquals(cache.size(), 1);
        cache.remove(1);
        Assert.assertNull(cache.get(1));
        Assert.assertEquals(cache.size(), 0);
    }
    
    @Test
    public void entriesExpire()
    {
        var clock = new MutableClock(Instant.EPOCH);
        var cache = new SubmissionCache(Duration.ofMinutes(10), clock);
        cache.put(1, "1001");
        clock.advance(Duration.ofMinutes(5));
        cache.put(2, "1002");
        
        clock.advance(Duration.ofMinutes(5));
        Assert.assertNull(cache.get(1), "entry at its ttl has expired");
        Assert.assertEquals(cache.get(2), "1002");
        
        clock.advance(Duration.ofMinutes(6));
        Assert.assertEquals(cache.purgeExpired(), 1);
        Assert.assertEquals(cache.size(), 0);
    }
    
    @Test
    public void invalidTtlRejected()
    {
        Assert.expectThrows(IllegalArgumentException.class, () -> new SubmissionCache(Duration.ZERO));
        Assert.expectThrows(IllegalArgumentException.class, () -> new SubmissionCache(null));
    }
}
