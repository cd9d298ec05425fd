package io.omnivector.jobbergate.agent.usermapper;

/** Maps the email address of a job submission's owner to the local account
 * the job is submitted for.
 */
public interface UserMapper
{
    /** Resolve a local user name.
     * 
     * @param ownerEmail the owner's email address as recorded by the API
     * @return the local user name, never null
     * @throws UserMappingException if no local user corresponds to the email
     */
    String getUsername(String ownerEmail) throws UserMappingException;
}
