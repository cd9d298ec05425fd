package io.omnivector.jobbergate.agent.daemon;

/** The work a scheduled task performs on each run. */
@FunctionalInterface
public interface TaskAction
{
    void run() throws Exception;
}
