package io.omnivector.jobbergate.agent.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/** The boundary between the agent and local processes.  Implementations
 * execute a command given as a discrete argument vector, never through a
 * shell, and must return once the timeout expires.
 */
public interface CommandRunner
{
    /** Run a command to completion or until the timeout expires.
     * 
     * @param argv the executable followed by its arguments
     * @param workDir the working directory, or null to inherit the agent's
     * @param timeout the maximum time to wait for the command
     * @return the non-null result, with timedOut set if the timeout expired
     * @throws IOException if the command could not be started
     * @throws InterruptedException if the wait was interrupted, after the 
     *                              command has been killed
     */
    CommandResult run(List<String> argv, Path workDir, Duration timeout) 
     throws IOException, InterruptedException;
}
