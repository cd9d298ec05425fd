package io.omnivector.jobbergate.agent.daemon;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.testng.Assert;
import org.testng.annotations.Test;

@Test(groups={"unit"})
public class ScheduledTaskTest 
{
    @Test
    public void failuresAreContained()
    {
        var task = new ScheduledTask("failing", Duration.ofSeconds(10), () -> {
            throw new IllegalStateException("boom");
        });
        task.run();
        task.run();
        Assert.assertEquals(task.getRunCount(), 2);
        Assert.assertEquals(task.getFailureCount(), 2);
        Assert.assertFalse(task.isRunning());
        Assert.assertNotNull(task.getLastEnd());
    }
    
    @Test
    public void overlappingRunIsSkipped() throws Exception
    {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var task = new ScheduledTask("slow", Duration.ofSeconds(10), () -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
        });
        
        var first = new Thread(task, "first-run");
        first.start();
        Assert.assertTrue(started.await(10, TimeUnit.SECONDS));
        Assert.assertTrue(task.isRunning());
        
        // The second run finds the first still in progress.
        task.run();
        Assert.assertEquals(task.getSkipCount(), 1);
        Assert.assertEquals(task.getRunCount(), 1);
        
        release.countDown();
        first.join(10000);
        Assert.assertFalse(task.isRunning());
        
        task.run();
        Assert.assertEquals(task.getRunCount(), 2);
        Assert.assertEquals(task.getFailureCount(), 0);
    }
}
