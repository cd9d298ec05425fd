package io.omnivector.jobbergate.agent.schedulers;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.config.RuntimeParameters;
import io.omnivector.jobbergate.agent.exceptions.JobNotFoundException;
import io.omnivector.jobbergate.agent.exceptions.QueryException;
import io.omnivector.jobbergate.agent.exceptions.SubmissionException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;
import io.omnivector.jobbergate.agent.model.SchedulerJobInfo;
import io.omnivector.jobbergate.agent.process.CommandResult;
import io.omnivector.jobbergate.agent.process.CommandRunner;
import io.omnivector.jobbergate.agent.schedulers.parsers.SbatchOutputParser;
import io.omnivector.jobbergate.agent.schedulers.parsers.ScontrolOutputParser;

/*
 * Class to submit, query and cancel slurm batch jobs through the slurm 
 * command line tools.  Every command is an argument vector executed 
 * directly, with the configured subprocess timeout.
 */
public final class SlurmScheduler 
 implements JobScheduler
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(SlurmScheduler.class);
    
    // Slurm job ids, including the array task form.
    private static final Pattern SLURM_ID_PATTERN = Pattern.compile("\\d+(_\\d+)?");

    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    private final Path          _sbatchPath;
    private final Path          _scontrolPath;
    private final Path          _scancelPath;
    private final Duration      _timeout;
    private final CommandRunner _runner;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public SlurmScheduler(RuntimeParameters parms, CommandRunner runner)
    {
        this(parms.getSbatchPath(), parms.getScontrolPath(), parms.getScancelPath(),
             parms.getSubprocessTimeout(), runner);
    }
    
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public SlurmScheduler(Path sbatchPath, Path scontrolPath, Path scancelPath,
                          Duration timeout, CommandRunner runner)
    {
        _sbatchPath = sbatchPath;
        _scontrolPath = scontrolPath;
        _scancelPath = scancelPath;
        _timeout = timeout;
        _runner = runner;
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* submit:                                                                */
    /* ---------------------------------------------------------------------- */
    @Override
    public String submit(Path script, List<String> directives, Path workDir) 
     throws SubmissionException, InterruptedException
    {
        // Assemble: sbatch --parsable [directives] script
        var argv = new ArrayList<String>();
        argv.add(_sbatchPath.toString());
        argv.add("--parsable");
        if (directives != null) argv.addAll(directives);
        argv.add(script.toString());
        
        // Run the command.
        CommandResult result;
        try {result = _runner.run(argv, workDir, _timeout);}
            catch (IOException e) {
                String msg = MsgUtils.getMsg("AGENT_SBATCH_EXEC_ERROR", String.join(" ", argv), e.getMessage());
                _log.error(msg, e);
                throw new SubmissionException(msg, e);
            }
        
        if (result.isTimedOut()) {
            String msg = MsgUtils.getMsg("AGENT_SBATCH_TIMEOUT", result.getCommand(), _timeout.toSeconds());
            throw new SubmissionException(msg);
        }
        if (result.getExitCode() != 0) {
            String msg = MsgUtils.getMsg("AGENT_SBATCH_FAILED", result.getExitCode(), 
                                         result.getDiagnosticText());
            throw new SubmissionException(msg);
        }
        
        String slurmId = SbatchOutputParser.getSlurmId(result.getStdout(), result.getCommand());
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("AGENT_SBATCH_SUBMITTED", script, slurmId));
        return slurmId;
    }
    
    /* ---------------------------------------------------------------------- */
    /* queryStatus:                                                           */
    /* ---------------------------------------------------------------------- */
    @Override
    public SchedulerJobInfo queryStatus(String schedulerJobId) 
     throws QueryException, InterruptedException
    {
        // Only well-formed ids ever reach the command line.  A malformed id
        // can never be found, so it's reported that way.
        validateId(schedulerJobId);
        
        var argv = List.of(_scontrolPath.toString(), "show", "job", schedulerJobId);
        CommandResult result = runQuery(argv);
        
        // Slurm exits non-zero for unknown ids, but check the text first
        // since that's the only reliable signal.
        if (ScontrolOutputParser.isJobNotFound(result.getStderr()) ||
            ScontrolOutputParser.isJobNotFound(result.getStdout())) 
        {
            String msg = MsgUtils.getMsg("AGENT_SCONTROL_NOT_FOUND", schedulerJobId);
            throw new JobNotFoundException(schedulerJobId, msg);
        }
        if (result.getExitCode() != 0) {
            String msg = MsgUtils.getMsg("AGENT_SCONTROL_FAILED", schedulerJobId, result.getExitCode(), 
                                         result.getDiagnosticText());
            throw new QueryException(msg);
        }
        
        return ScontrolOutputParser.parse(schedulerJobId, result.getStdout());
    }
    
    /* ---------------------------------------------------------------------- */
    /* cancel:                                                                */
    /* ---------------------------------------------------------------------- */
    @Override
    public void cancel(String schedulerJobId) throws QueryException, InterruptedException
    {
        validateId(schedulerJobId);
        
        var argv = List.of(_scancelPath.toString(), schedulerJobId);
        CommandResult result = runQuery(argv);
        if (result.getExitCode() != 0) {
            String msg = MsgUtils.getMsg("AGENT_SCANCEL_FAILED", schedulerJobId, result.getExitCode(), 
                                         result.getDiagnosticText());
            throw new QueryException(msg);
        }
        _log.info(MsgUtils.getMsg("AGENT_SCANCEL_ISSUED", schedulerJobId));
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* runQuery:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Run a status or cancel command, mapping execution failures and 
     * timeouts to query exceptions.  Interruption is passed through.
     */
    private CommandResult runQuery(List<String> argv) throws QueryException, InterruptedException
    {
        CommandResult result;
        try {result = _runner.run(argv, null, _timeout);}
            catch (IOException e) {
                String msg = MsgUtils.getMsg("AGENT_QUERY_EXEC_ERROR", String.join(" ", argv), e.getMessage());
                _log.error(msg, e);
                throw new QueryException(msg, e);
            }
        
        if (result.isTimedOut()) {
            String msg = MsgUtils.getMsg("AGENT_QUERY_TIMEOUT", result.getCommand(), _timeout.toSeconds());
            throw new QueryException(msg);
        }
        return result;
    }
    
    /* ---------------------------------------------------------------------- */
    /* validateId:                                                            */
    /* ---------------------------------------------------------------------- */
    private static void validateId(String schedulerJobId) throws JobNotFoundException
    {
        if (schedulerJobId == null || !SLURM_ID_PATTERN.matcher(schedulerJobId).matches()) {
            String msg = MsgUtils.getMsg("AGENT_INVALID_SLURM_ID", schedulerJobId);
            throw new JobNotFoundException(schedulerJobId, msg);
        }
    }
}
