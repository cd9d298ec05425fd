package io.omnivector.jobbergate.agent.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.i18n.MsgUtils;

/** Run commands as child processes of the agent.  Output is redirected to
 * temporary files rather than pipes so that a chatty command can never
 * block on a full pipe buffer and outlive its timeout.
 */
public final class LocalCommandRunner 
 implements CommandRunner
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(LocalCommandRunner.class);
    
    // How long to wait for a killed process to be reaped.
    private static final long DESTROY_WAIT_MILLIS = 2000;
    
    // Temporary output file naming.
    private static final String TMP_PREFIX = "jobbergate-cmd-";

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* run:                                                                   */
    /* ---------------------------------------------------------------------- */
    @Override
    public CommandResult run(List<String> argv, Path workDir, Duration timeout) 
     throws IOException, InterruptedException
    {
        if (argv == null || argv.isEmpty()) 
            throw new IllegalArgumentException(MsgUtils.getMsg("AGENT_NULL_PARAMETER", "run", "argv"));
        String cmd = String.join(" ", argv);
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("AGENT_CMD_STARTING", cmd, workDir, timeout.toMillis()));
        
        Path outFile = Files.createTempFile(TMP_PREFIX, ".out");
        Path errFile = null;
        try {
            errFile = Files.createTempFile(TMP_PREFIX, ".err");
            
            // Start the process.  A missing executable surfaces here as an IOException.
            var pb = new ProcessBuilder(argv);
            if (workDir != null) pb.directory(workDir.toFile());
            pb.redirectOutput(outFile.toFile());
            pb.redirectError(errFile.toFile());
            Process process = pb.start();
            process.getOutputStream().close();
            
            // Wait no longer than the timeout.
            boolean finished;
            try {finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);}
                catch (InterruptedException e) {
                    process.destroyForcibly();
                    _log.warn(MsgUtils.getMsg("AGENT_CMD_INTERRUPTED", cmd));
                    throw e;
                }
            
            // Kill the process on timeout and return whatever it produced.
            if (!finished) {
                process.destroyForcibly();
                try {process.waitFor(DESTROY_WAIT_MILLIS, TimeUnit.MILLISECONDS);}
                    catch (InterruptedException e) {Thread.currentThread().interrupt();}
                _log.warn(MsgUtils.getMsg("AGENT_CMD_TIMEOUT", cmd, timeout.toMillis()));
                return CommandResult.timedOut(argv, readOutput(outFile), readOutput(errFile));
            }
            
            var result = CommandResult.completed(argv, process.exitValue(), 
                                                 readOutput(outFile), readOutput(errFile));
            if (result.getExitCode() != 0 && _log.isDebugEnabled())
                _log.debug(MsgUtils.getMsg("AGENT_CMD_NONZERO_EXIT", cmd, result.getExitCode(), 
                                           result.getDiagnosticText()));
            return result;
        }
        finally {
            deleteTempFile(outFile);
            if (errFile != null) deleteTempFile(errFile);
        }
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* readOutput:                                                            */
    /* ---------------------------------------------------------------------- */
    private static String readOutput(Path file) throws IOException
    {
        return FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
    }
    
    /* ---------------------------------------------------------------------- */
    /* deleteTempFile:                                                        */
    /* ---------------------------------------------------------------------- */
    private static void deleteTempFile(Path file)
    {
        try {Files.deleteIfExists(file);}
            catch (IOException e) {
                _log.warn(MsgUtils.getMsg("AGENT_TMP_FILE_DELETE_ERROR", file, e.getMessage()));
            }
    }
}
