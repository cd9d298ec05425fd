package io.omnivector.jobbergate.agent.schedulers.parsers;

import org.testng.Assert;
import org.testng.annotations.Test;

import io.omnivector.jobbergate.agent.exceptions.QueryException;
import io.omnivector.jobbergate.agent.model.enumerations.JobState;

@Test(groups={"unit"})
public class ScontrolOutputParserTest 
{
    // Captured from "scontrol show job 1001" on slurm 23.02.
    private static final String RUNNING_OUTPUT = 
        "JobId=1001 JobName=hello world\n" +
        "   UserId=ubuntu(1000) GroupId=ubuntu(1000) MCS_label=N/A\n" +
        "   Priority=4294901759 Nice=0 Account=(null) QOS=normal\n" +
        "   JobState=RUNNING Reason=None Dependency=(null)\n" +
        "   Requeue=1 Restarts=0 BatchFlag=1 Reboot=0 ExitCode=0:0\n" +
        "   RunTime=00:00:05 TimeLimit=UNLIMITED TimeMin=N/A\n" +
        "   SubmitTime=2024-03-01T10:00:00 EligibleTime=2024-03-01T10:00:00\n" +
        "   Partition=compute AllocNode:Sid=head:4242\n" +
        "   NodeList=node1 BatchHost=node1\n" +
        "   NumNodes=2 NumCPUs=2 NumTasks=2 CPUs/Task=1 ReqB:S:C:T=0:0:*:*\n" +
        "   Command=/home/ubuntu/run.sh\n" +
        "   WorkDir=/home/ubuntu\n" +
        "   StdOut=/home/ubuntu/slurm-1001.out\n" +
        "\n";
    
    @Test
    public void runningJob() throws QueryException
    {
        var info = ScontrolOutputParser.parse("1001", RUNNING_OUTPUT);
        Assert.assertEquals(info.getSchedulerJobId(), "1001");
        Assert.assertEquals(info.getRawState(), "RUNNING");
        Assert.assertEquals(info.getJobState(), JobState.RUNNING);
        Assert.assertNull(info.getReason(), "Reason=None must read as absent");
        
        var fields = info.getFields();
        Assert.assertEquals(fields.get("JobName"), "hello world");
        Assert.assertEquals(fields.get("UserId"), "ubuntu(1000)");
        Assert.assertEquals(fields.get("AllocNode:Sid"), "head:4242");
        Assert.assertEquals(fields.get("CPUs/Task"), "1");
        Assert.assertEquals(fields.get("ReqB:S:C:T"), "0:0:*:*");
        Assert.assertEquals(fields.get("WorkDir"), "/home/ubuntu");
    }
    
    @Test
    public void valueSplitAtFirstEquals() throws QueryException
    {
        String output = "JobId=5 JobState=PENDING Reason=Resources Comment=a=b=c";
        var info = ScontrolOutputParser.parse("5", output);
        Assert.assertEquals(info.getFields().get("Comment"), "a=b=c");
        Assert.assertEquals(info.getReason(), "Resources");
        Assert.assertEquals(info.getJobState(), JobState.QUEUED);
    }
    
    @Test
    public void noiseLinesSkipped() throws QueryException
    {
        String output = "slurm_load_jobs warning: something odd\n" +
                        "JobId=9 JobState=COMPLETED Reason=None\n" +
                        "trailing noise without pairs\n";
        var info = ScontrolOutputParser.parse("9", output);
        Assert.assertEquals(info.getJobState(), JobState.COMPLETED);
        Assert.assertEquals(info.getFields().size(), 3);
    }
    
    @Test
    public void onlyFirstRecordRead() throws QueryException
    {
        String output = "JobId=10 JobState=RUNNING\n\nJobId=11 JobState=FAILED\n";
        var info = ScontrolOutputParser.parse("10", output);
        Assert.assertEquals(info.getRawState(), "RUNNING");
    }
    
    @Test
    public void timeoutGetsDefaultReason() throws QueryException
    {
        var info = ScontrolOutputParser.parse("12", "JobId=12 JobState=TIMEOUT Reason=None");
        Assert.assertEquals(info.getJobState(), JobState.FAILED);
        Assert.assertTrue(info.getJobState().isTerminal());
        Assert.assertEquals(info.getEffectiveReason(), "timeout");
    }
    
    @Test
    public void timeoutReasonIsFixed() throws QueryException
    {
        var info = ScontrolOutputParser.parse("14", "JobId=14 JobState=TIMEOUT Reason=TimeLimit");
        Assert.assertEquals(info.getReason(), "TimeLimit");
        Assert.assertEquals(info.getEffectiveReason(), "timeout");
        
        // Other states keep slurm's reason.
        info = ScontrolOutputParser.parse("15", "JobId=15 JobState=FAILED Reason=NonZeroExitCode");
        Assert.assertEquals(info.getEffectiveReason(), "NonZeroExitCode");
    }
    
    @Test
    public void decoratedStateNormalized() throws QueryException
    {
        // The state value is a single token, anything after it continues it.
        var info = ScontrolOutputParser.parse("13", "JobId=13 JobState=CANCELLED by 1000 Reason=None");
        Assert.assertEquals(info.getRawState(), "CANCELLED by 1000");
        Assert.assertEquals(info.getJobState(), JobState.CANCELLED);
    }
    
    @Test
    public void unknownStateIsUnrecognized() throws QueryException
    {
        var info = ScontrolOutputParser.parse("14", "JobId=14 JobState=WARPING");
        Assert.assertEquals(info.getJobState(), JobState.UNRECOGNIZED);
        Assert.assertFalse(info.getJobState().isTerminal());
    }
    
    @Test
    public void missingStateFails()
    {
        var e = Assert.expectThrows(QueryException.class, 
                    () -> ScontrolOutputParser.parse("15", "JobId=15 JobName=x Reason=None"));
        Assert.assertTrue(e.getReason().contains("JobState"), e.getReason());
    }
    
    @Test
    public void mismatchedIdFails()
    {
        Assert.expectThrows(QueryException.class, 
                            () -> ScontrolOutputParser.parse("16", "JobId=61 JobState=RUNNING"));
    }
    
    @Test
    public void malformedOutputFails()
    {
        Assert.expectThrows(QueryException.class, () -> ScontrolOutputParser.parse("17", ""));
        Assert.expectThrows(QueryException.class, () -> ScontrolOutputParser.parse("17", "garbage text here"));
        Assert.expectThrows(QueryException.class, () -> ScontrolOutputParser.parse("17", "=RUNNING 1=2"));
    }
    
    @Test
    public void partialOutputWithoutId() throws QueryException
    {
        // Truncated output still parses if the state made it.
        var info = ScontrolOutputParser.parse("18", "   JobState=PENDING Reason=Priority Dependency=(null)");
        Assert.assertEquals(info.getJobState(), JobState.QUEUED);
        Assert.assertEquals(info.getReason(), "Priority");
    }
    
    // Shape of "scontrol show job 123" for "sbatch --array=1-3" once every
    // task has started; the array's own id is carried by the last task.
    private static final String ARRAY_OUTPUT = 
        "JobId=124 ArrayJobId=123 ArrayTaskId=1 JobName=sweep\n" +
        "   JobState=COMPLETED Reason=None Dependency=(null)\n" +
        "   ExitCode=0:0\n" +
        "\n" +
        "JobId=125 ArrayJobId=123 ArrayTaskId=2 JobName=sweep\n" +
        "   JobState=RUNNING Reason=None Dependency=(null)\n" +
        "\n" +
        "JobId=123 ArrayJobId=123 ArrayTaskId=3 JobName=sweep\n" +
        "   JobState=COMPLETED Reason=None Dependency=(null)\n" +
        "\n";
    
    @Test
    public void arrayJobFollowsUnfinishedTask() throws QueryException
    {
        var info = ScontrolOutputParser.parse("123", ARRAY_OUTPUT);
        Assert.assertEquals(info.getSchedulerJobId(), "123");
        Assert.assertEquals(info.getJobState(), JobState.RUNNING);
        Assert.assertEquals(info.getFields().get("JobId"), "125");
    }
    
    @Test
    public void finishedArrayJobIsTerminal() throws QueryException
    {
        String output = ARRAY_OUTPUT.replace("JobState=RUNNING", "JobState=FAILED");
        var info = ScontrolOutputParser.parse("123", output);
        Assert.assertTrue(info.getJobState().isTerminal());
        Assert.assertEquals(info.getFields().get("JobId"), "123");
    }
    
    @Test
    public void arrayTaskSelectedByTaskId() throws QueryException
    {
        String output = "JobId=124 ArrayJobId=123 ArrayTaskId=1 JobName=sweep\n" +
                        "   JobState=COMPLETED Reason=None\n";
        var info = ScontrolOutputParser.parse("123", output);
        Assert.assertEquals(info.getJobState(), JobState.COMPLETED);
        
        info = ScontrolOutputParser.parse("123_1", output);
        Assert.assertEquals(info.getJobState(), JobState.COMPLETED);
        Assert.expectThrows(QueryException.class, () -> ScontrolOutputParser.parse("123_2", output));
    }
    
    @Test
    public void recordsSplitOnBlankLines()
    {
        var records = ScontrolOutputParser.parseRecords(ARRAY_OUTPUT);
        Assert.assertEquals(records.size(), 3);
        Assert.assertEquals(records.get(2).get("ArrayTaskId"), "3");
    }
    
    @Test
    public void jobNotFoundDetection()
    {
        Assert.assertTrue(ScontrolOutputParser.isJobNotFound("slurm_load_jobs error: Invalid job id specified"));
        Assert.assertTrue(ScontrolOutputParser.isJobNotFound("INVALID JOB ID SPECIFIED"));
        Assert.assertFalse(ScontrolOutputParser.isJobNotFound("Socket timed out on send/recv operation"));
        Assert.assertFalse(ScontrolOutputParser.isJobNotFound(null));
    }
}
