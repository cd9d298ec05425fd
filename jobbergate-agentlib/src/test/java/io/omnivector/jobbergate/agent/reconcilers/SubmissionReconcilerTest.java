package io.omnivector.jobbergate.agent.reconcilers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.omnivector.jobbergate.agent.model.JobScript;
import io.omnivector.jobbergate.agent.model.JobScriptFile;
import io.omnivector.jobbergate.agent.model.PendingJobSubmission;
import io.omnivector.jobbergate.agent.model.ReconciliationReport;
import io.omnivector.jobbergate.agent.model.enumerations.JobFileType;
import io.omnivector.jobbergate.agent.model.enumerations.ReconcileOutcome;
import io.omnivector.jobbergate.agent.testutils.FakeJobScheduler;
import io.omnivector.jobbergate.agent.testutils.FakeJobbergateApi;
import io.omnivector.jobbergate.agent.testutils.MutableClock;
import io.omnivector.jobbergate.agent.usermapper.SingleUserMapper;

@Test(groups={"unit"})
public class SubmissionReconcilerTest 
{
    private static final Duration TTL = Duration.ofHours(12);
    
    private Path              _workDir;
    private FakeJobbergateApi _api;
    private FakeJobScheduler  _scheduler;
    private MutableClock      _clock;
    private SubmissionCache   _cache;
    
    @BeforeMethod
    public void setup() throws IOException
    {
        _workDir = Files.createTempDirectory("jobbergate-workdir-");
        _api = new FakeJobbergateApi();
        _scheduler = new FakeJobScheduler();
        _clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        _cache = new SubmissionCache(TTL, _clock);
    }
    
    @AfterMethod
    public void cleanup() throws IOException
    {
        FileUtils.deleteDirectory(_workDir.toFile());
    }
    
    /* ---------------------------------------------------------------------- */
    /* Core scenarios                                                         */
    /* ---------------------------------------------------------------------- */
    @Test
    public void freshSubmission()
    {
        _api.addPending(pendingJob(42, "run.sh", List.of("-N", "2")));
        _scheduler.nextId(1001);
        
        var report = newReconciler(true).reconcile();
        
        Assert.assertEquals(_api.getSubmitted().size(), 1);
        Assert.assertEquals(_api.getSubmitted().get(0).id, 42L);
        Assert.assertEquals(_api.getSubmitted().get(0).slurmJobId, "1001");
        Assert.assertFalse(_cache.contains(42));
        Assert.assertEquals(_cache.size(), 0);
        
        Assert.assertEquals(_scheduler.getSubmissions().size(), 1);
        var submission = _scheduler.getSubmissions().get(0);
        Assert.assertEquals(submission.directives, List.of("-N", "2"));
        Assert.assertEquals(submission.workDir, _workDir);
        Assert.assertEquals(submission.scriptContent, scriptText("run.sh"));
        
        // The initial scheduler state rides along with the report.
        Assert.assertNotNull(_api.getSubmitted().get(0).info);
        Assert.assertEquals(_api.getSubmitted().get(0).info.getRawState(), "PENDING");
        
        Assert.assertEquals(report.getFetched(), 1);
        Assert.assertEquals(report.getCount(ReconcileOutcome.SUBMITTED), 1);
    }
    
    @Test
    public void reportFailureThenRecovery()
    {
        _api.addPending(pendingJob(42, "run.sh", List.of("-N", "2")));
        _scheduler.nextId(1001);
        _api.failNextSubmittedReports(1);
        var reconciler = newReconciler(true);
        
        // First cycle: submitted but the report fails.
        var report1 = reconciler.reconcile();
        Assert.assertEquals(_scheduler.getSubmissions().size(), 1);
        Assert.assertTrue(_api.getSubmitted().isEmpty());
        Assert.assertTrue(_cache.contains(42));
        Assert.assertEquals(_cache.get(42), "1001");
        Assert.assertEquals(report1.getCount(ReconcileOutcome.REPORT_FAILED), 1);
        
        // Second cycle: no new submission, the report is retried.
        var report2 = reconciler.reconcile();
        Assert.assertEquals(_scheduler.getSubmissions().size(), 1, "job must not be submitted twice");
        Assert.assertEquals(_api.getSubmittedAttempts(), 2);
        Assert.assertEquals(_api.getSubmitted().size(), 1);
        Assert.assertEquals(_api.getSubmitted().get(0).slurmJobId, "1001");
        Assert.assertFalse(_cache.contains(42));
        Assert.assertEquals(report2.getCount(ReconcileOutcome.REPORT_RETRIED), 1);
        Assert.assertEquals(report2.getCount(ReconcileOutcome.SUBMITTED), 0);
    }
    
    @Test
    public void neverResubmittedWhileCached()
    {
        _api.addPending(pendingJob(8, "run.sh", List.of()));
        _api.failNextSubmittedReports(Integer.MAX_VALUE);
        var reconciler = newReconciler(true);
        
        for (int i = 0; i < 5; i++) {
            reconciler.reconcile();
            _clock.advance(Duration.ofMinutes(1));
        }
        Assert.assertEquals(_scheduler.getSubmissions().size(), 1);
        Assert.assertEquals(_api.getSubmittedAttempts(), 5);
        Assert.assertTrue(_cache.contains(8));
    }
    
    @Test
    public void expiredEntryAllowsResubmission()
    {
        _api.addPending(pendingJob(9, "run.sh", List.of()));
        _api.failNextSubmittedReports(1);
        var reconciler = newReconciler(true);
        
        reconciler.reconcile();
        Assert.assertTrue(_cache.contains(9));
        
        // Past the time-to-live the guard is gone.
        _clock.advance(TTL.plusSeconds(1));
        var report = reconciler.reconcile();
        Assert.assertEquals(_scheduler.getSubmissions().size(), 2);
        Assert.assertEquals(report.getCount(ReconcileOutcome.SUBMITTED), 1);
        Assert.assertFalse(_cache.contains(9));
    }
    
    @Test
    public void perJobIsolation()
    {
        for (int i = 1; i <= 5; i++) _api.addPending(pendingJob(i, "job" + i + ".sh", List.of()));
        _scheduler.failSubmission("job3.sh", "sbatch exited with code 1: sbatch: error: invalid partition");
        
        var report = newReconciler(true).reconcile();
        
        Assert.assertEquals(_scheduler.getSubmissions().size(), 5);
        var reported = new ArrayList<Long>();
        for (var s : _api.getSubmitted()) reported.add(s.id);
        Assert.assertEquals(reported, List.of(1L, 2L, 4L, 5L));
        
        Assert.assertEquals(_api.getRejected().size(), 1);
        String reason = _api.getRejected().get(3L);
        Assert.assertTrue(reason.startsWith("Failed to submit job to slurm"), reason);
        Assert.assertTrue(reason.contains("invalid partition"), reason);
        Assert.assertFalse(_cache.contains(3));
        
        Assert.assertEquals(report.getCount(ReconcileOutcome.SUBMITTED), 4);
        Assert.assertEquals(report.getCount(ReconcileOutcome.REJECTED), 1);
    }
    
    @Test
    public void timeoutIsRejection()
    {
        _api.addPending(pendingJob(11, "slow.sh", List.of()));
        _scheduler.failSubmission("slow.sh", "sbatch timed out after 60 seconds: /usr/bin/sbatch --parsable slow.sh");
        
        newReconciler(true).reconcile();
        Assert.assertTrue(_api.getRejected().get(11L).contains("timed out"));
        Assert.assertTrue(_api.getSubmitted().isEmpty());
    }
    
    @Test
    public void fetchFailureSkipsCycle()
    {
        _api.addPending(pendingJob(1, "run.sh", List.of()));
        _api.fetchFails(true);
        
        var report = newReconciler(true).reconcile();
        Assert.assertTrue(report.isFetchFailed());
        Assert.assertTrue(_scheduler.getSubmissions().isEmpty());
        Assert.assertTrue(_api.getRejected().isEmpty());
    }
    
    @Test
    public void initialQueryFailureStillReports()
    {
        _api.addPending(pendingJob(12, "run.sh", List.of()));
        _scheduler.nextId(500).queryFails("500", "scontrol timed out");
        
        newReconciler(true).reconcile();
        Assert.assertEquals(_api.getSubmitted().size(), 1);
        Assert.assertNull(_api.getSubmitted().get(0).info);
    }
    
    @Test
    public void interruptedSubmissionStaysPending()
    {
        for (int i = 1; i <= 3; i++) _api.addPending(pendingJob(60 + i, "job" + i + ".sh", List.of()));
        _scheduler.interruptSubmission("job2.sh");
        
        ReconciliationReport report;
        boolean interrupted;
        try {
            report = newReconciler(true).reconcile();
        } finally {
            interrupted = Thread.interrupted();
        }
        
        Assert.assertTrue(interrupted, "interrupt flag restored for the caller");
        Assert.assertEquals(_scheduler.getSubmissions().size(), 2, "third job never reaches sbatch");
        Assert.assertEquals(_api.getSubmitted().size(), 1);
        Assert.assertEquals(_api.getSubmitted().get(0).id, 61L);
        Assert.assertTrue(_api.getRejected().isEmpty(), "an interrupt is not a rejection");
        Assert.assertFalse(_cache.contains(62));
        Assert.assertEquals(report.getCount(ReconcileOutcome.REJECTED), 0);
        Assert.assertEquals(report.getCount(ReconcileOutcome.INTERRUPTED), 2);
    }
    
    @Test
    public void interruptedThreadSubmitsNothing()
    {
        _api.addPending(pendingJob(70, "run.sh", List.of()));
        
        ReconciliationReport report;
        Thread.currentThread().interrupt();
        try {
            report = newReconciler(true).reconcile();
        } finally {
            Thread.interrupted();
        }
        
        Assert.assertTrue(_scheduler.getSubmissions().isEmpty());
        Assert.assertTrue(_api.getRejected().isEmpty());
        Assert.assertTrue(_api.getSubmitted().isEmpty());
        Assert.assertEquals(report.getCount(ReconcileOutcome.INTERRUPTED), 1);
    }
    
    /* ---------------------------------------------------------------------- */
    /* Staging                                                                */
    /* ---------------------------------------------------------------------- */
    @Test
    public void missingEntrypointRejected()
    {
        var job = pendingJob(20, "run.sh", List.of());
        job.getJobScript().getFiles().clear();
        _api.addPending(job);
        
        newReconciler(true).reconcile();
        Assert.assertTrue(_api.getRejected().containsKey(20L));
        Assert.assertTrue(_scheduler.getSubmissions().isEmpty());
    }
    
    @Test
    public void invalidExecutionDirectoryRejected()
    {
        var relative = pendingJob(21, "run.sh", List.of());
        relative.setExecutionDirectory("relative/dir");
        var missing = pendingJob(22, "run.sh", List.of());
        missing.setExecutionDirectory(_workDir.resolve("does-not-exist").toString());
        _api.addPending(relative).addPending(missing);
        
        newReconciler(true).reconcile();
        Assert.assertTrue(_api.getRejected().get(21L).startsWith("Execution directory is invalid"));
        Assert.assertTrue(_api.getRejected().get(22L).startsWith("Execution directory is invalid"));
        Assert.assertTrue(_scheduler.getSubmissions().isEmpty());
    }
    
    @Test
    public void defaultWorkDirUsesUsername() throws IOException
    {
        Path userDir = Files.createDirectory(_workDir.resolve("ubuntu"));
        var job = pendingJob(23, "run.sh", List.of());
        job.setExecutionDirectory(null);
        _api.addPending(job);
        
        var fileManager = new JobFileManager(_api, _workDir.toString() + "/{username}", true);
        new SubmissionReconciler(_api, _scheduler, new SingleUserMapper("ubuntu"), fileManager, _cache).reconcile();
        
        Assert.assertEquals(_scheduler.getSubmissions().get(0).workDir, userDir);
        Assert.assertTrue(Files.exists(userDir.resolve("run.sh")));
    }
    
    @Test
    public void supportFilesWritten() throws IOException
    {
        var job = pendingJob(24, "run.sh", List.of());
        var support = new JobScriptFile(240, "data/input.txt", JobFileType.SUPPORT);
        job.getJobScript().getFiles().add(support);
        _api.addPending(job).addFile(support, "payload");
        
        newReconciler(true).reconcile();
        
        // Only the last path element is used.
        Assert.assertEquals(Files.readString(_workDir.resolve("input.txt")), "payload");
        Assert.assertEquals(_scheduler.getSubmissions().get(0).script, _workDir.resolve("run.sh"));
        Assert.assertEquals(_api.getSubmitted().size(), 1);
    }
    
    @Test
    public void supportFilesRejectedWhenWritingDisabled()
    {
        var job = pendingJob(25, "run.sh", List.of());
        var support = new JobScriptFile(250, "input.txt", JobFileType.SUPPORT);
        job.getJobScript().getFiles().add(support);
        _api.addPending(job).addFile(support, "payload");
        
        newReconciler(false).reconcile();
        Assert.assertTrue(_api.getRejected().containsKey(25L));
        Assert.assertTrue(_scheduler.getSubmissions().isEmpty());
    }
    
    @Test
    public void stagingDirRemovedWhenWritingDisabled()
    {
        _api.addPending(pendingJob(26, "run.sh", List.of()));
        
        newReconciler(false).reconcile();
        var submission = _scheduler.getSubmissions().get(0);
        Assert.assertNotEquals(submission.script.getParent(), _workDir);
        Assert.assertEquals(submission.scriptContent, scriptText("run.sh"));
        Assert.assertFalse(Files.exists(submission.script), "staging directory should be removed");
        Assert.assertFalse(Files.exists(_workDir.resolve("run.sh")));
    }
    
    @Test
    public void fileDownloadFailureRejected()
    {
        var job = pendingJob(27, "run.sh", List.of());
        job.getJobScript().getFiles().get(0).setFilename("missing.sh");
        _api.addPending(job);
        
        newReconciler(true).reconcile();
        Assert.assertTrue(_api.getRejected().get(27L).startsWith("Error processing job-script files"));
    }
    
    /* ---------------------------------------------------------------------- */
    /* Helpers                                                                */
    /* ---------------------------------------------------------------------- */
    private SubmissionReconciler newReconciler(boolean writeSubmissionFiles)
    {
        var fileManager = new JobFileManager(_api, _workDir.toString(), writeSubmissionFiles);
        return new SubmissionReconciler(_api, _scheduler, new SingleUserMapper("ubuntu"), fileManager, _cache);
    }
    
    private PendingJobSubmission pendingJob(long id, String scriptName, List<String> directives)
    {
        var entrypoint = new JobScriptFile(id * 10, scriptName, JobFileType.ENTRYPOINT);
        _api.addFile(entrypoint, scriptText(scriptName));
        
        var script = new JobScript();
        script.getFiles().add(entrypoint);
        
        var job = new PendingJobSubmission();
        job.setId(id);
        job.setName("job-" + id);
        job.setOwnerEmail("owner@example.com");
        job.setExecutionDirectory(_workDir.toString());
        job.setSbatchArguments(new ArrayList<>(directives));
        job.setJobScript(script);
        return job;
    }
    
    private static String scriptText(String name)
    {
        return "#!/bin/bash\n#SBATCH --job-name=" + name + "\necho hello\n";
    }
}
