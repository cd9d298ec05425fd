package io.omnivector.jobbergate.agent.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

@Test(groups={"unit"})
public class LocalCommandRunnerTest 
{
    private final LocalCommandRunner _runner = new LocalCommandRunner();
    
    @Test
    public void capturesOutputAndExitCode() throws Exception
    {
        var result = _runner.run(List.of("/bin/sh", "-c", "echo out; echo err 1>&2; exit 3"), 
                                 null, Duration.ofSeconds(10));
        Assert.assertFalse(result.isTimedOut());
        Assert.assertEquals(result.getExitCode(), 3);
        Assert.assertFalse(result.isSuccess());
        Assert.assertEquals(result.getStdout().strip(), "out");
        Assert.assertEquals(result.getStderr().strip(), "err");
        Assert.assertEquals(result.getDiagnosticText(), "err");
    }
    
    @Test
    public void argumentsAreNotInterpreted() throws Exception
    {
        // Shell metacharacters reach the program untouched.
        String arg = "a b; echo injected $(id) `id`";
        var result = _runner.run(List.of("echo", arg), null, Duration.ofSeconds(10));
        Assert.assertTrue(result.isSuccess());
        Assert.assertEquals(result.getStdout().strip(), arg);
    }
    
    @Test
    public void runsInWorkingDirectory() throws Exception
    {
        Path dir = Files.createTempDirectory("jobbergate-runner-");
        try {
            var result = _runner.run(List.of("pwd"), dir, Duration.ofSeconds(10));
            Assert.assertEquals(Path.of(result.getStdout().strip()).toRealPath(), dir.toRealPath());
        } finally {
            Files.deleteIfExists(dir);
        }
    }
    
    @Test
    public void timeoutIsEnforced() throws Exception
    {
        long start = System.nanoTime();
        var result = _runner.run(List.of("sleep", "30"), null, Duration.ofMillis(500));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        
        Assert.assertTrue(result.isTimedOut());
        Assert.assertFalse(result.isSuccess());
        Assert.assertTrue(elapsedMillis < 5000, "returned after " + elapsedMillis + " ms");
    }
    
    @Test
    public void interruptKillsCommand()
    {
        long start = System.nanoTime();
        Thread.currentThread().interrupt();
        try {
            Assert.expectThrows(InterruptedException.class, 
                () -> _runner.run(List.of("sleep", "30"), null, Duration.ofSeconds(60)));
        } finally {
            Thread.interrupted();
        }
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        Assert.assertTrue(elapsedMillis < 5000, "returned after " + elapsedMillis + " ms");
    }
    
    @Test
    public void missingExecutableThrows()
    {
        Assert.expectThrows(IOException.class, 
            () -> _runner.run(List.of("/nonexistent/bin/sbatch"), null, Duration.ofSeconds(5)));
    }
    
    @Test
    public void emptyArgvRejected()
    {
        Assert.expectThrows(IllegalArgumentException.class, 
                            () -> _runner.run(List.of(), null, Duration.ofSeconds(5)));
    }
}
