package io.omnivector.jobbergate.agent.process;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

/** The outcome of one command execution.  The exit code is meaningless when
 * the command timed out.
 */
public final class CommandResult 
{
    // Longest output excerpt included in messages.
    private static final int MAX_EXCERPT_LENGTH = 2048;
    
    private final List<String> _argv;
    private final int     _exitCode;
    private final String  _stdout;
    private final String  _stderr;
    private final boolean _timedOut;
    
    public CommandResult(List<String> argv, int exitCode, String stdout, String stderr, boolean timedOut)
    {
        _argv = List.copyOf(argv);
        _exitCode = exitCode;
        _stdout = stdout == null ? "" : stdout;
        _stderr = stderr == null ? "" : stderr;
        _timedOut = timedOut;
    }
    
    /** A result for a command that ran to completion. */
    public static CommandResult completed(List<String> argv, int exitCode, String stdout, String stderr)
    {return new CommandResult(argv, exitCode, stdout, stderr, false);}
    
    /** A result for a command that was killed after its timeout. */
    public static CommandResult timedOut(List<String> argv, String stdout, String stderr)
    {return new CommandResult(argv, -1, stdout, stderr, true);}
    
    public boolean isSuccess() {return !_timedOut && _exitCode == 0;}
    
    /** The command line for messages.  Arguments are not quoted. */
    public String getCommand() {return String.join(" ", _argv);}
    
    /** Stderr if there is any, otherwise stdout, trimmed and abbreviated. */
    public String getDiagnosticText()
    {
        String text = StringUtils.isNotBlank(_stderr) ? _stderr : _stdout;
        return StringUtils.abbreviate(text.strip(), MAX_EXCERPT_LENGTH);
    }
    
    public List<String> getArgv() {return _argv;}
    public int getExitCode() {return _exitCode;}
    public String getStdout() {return _stdout;}
    public String getStderr() {return _stderr;}
    public boolean isTimedOut() {return _timedOut;}
}
