package io.omnivector.jobbergate.agent.model.enumerations;

/** The role a file plays in a job script.  Exactly one ENTRYPOINT file is
 * handed to the scheduler; SUPPORT files accompany it in the working
 * directory; TEMPLATE files are only meaningful to the API and CLI.
 */
public enum JobFileType 
{
    ENTRYPOINT,
    SUPPORT,
    TEMPLATE
}
