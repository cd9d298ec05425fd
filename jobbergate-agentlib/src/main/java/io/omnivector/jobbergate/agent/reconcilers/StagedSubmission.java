package io.omnivector.jobbergate.agent.reconcilers;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.i18n.MsgUtils;

/** The files of one job submission laid out on disk and ready for sbatch.
 * Closing removes the private staging directory; files copied into the 
 * working directory are left in place for the job.
 */
public final class StagedSubmission 
 implements AutoCloseable
{
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(StagedSubmission.class);
    
    private final long _jobSubmissionId;
    private final Path _stagingDir;
    private final Path _scriptPath;
    
    StagedSubmission(long jobSubmissionId, Path stagingDir, Path scriptPath)
    {
        _jobSubmissionId = jobSubmissionId;
        _stagingDir = stagingDir;
        _scriptPath = scriptPath;
    }
    
    @Override
    public void close()
    {
        try {FileUtils.deleteDirectory(_stagingDir.toFile());}
            catch (IOException e) {
                _log.warn(MsgUtils.getMsg("AGENT_STAGING_CLEANUP_ERROR", _jobSubmissionId, _stagingDir, 
                                          e.getMessage()));
            }
    }
    
    /** The script to hand to the scheduler. */
    public Path getScriptPath() {return _scriptPath;}
    public Path getStagingDir() {return _stagingDir;}
}
