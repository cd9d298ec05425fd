package io.omnivector.jobbergate.agent.model;

import java.util.ArrayList;
import java.util.List;

/** A job submission the API has created but that has not yet been handed
 * to the scheduler.  The agent only reads these.
 */
public class PendingJobSubmission 
{
    // Identity.
    private long    id;
    private String  name;
    private String  ownerEmail;
    
    // Where and how to submit.
    private String  executionDirectory;
    private List<String> sbatchArguments = new ArrayList<String>();
    private JobScript jobScript;
    
    // Constructors.
    public PendingJobSubmission() {}
    
    // Accessors
    public long getId() {
        return id;
    }
    public void setId(long id) {
        this.id = id;
    }
    public String getName() {
        return name;
    }
    public void setName(String name) {
        this.name = name;
    }
    public String getOwnerEmail() {
        return ownerEmail;
    }
    public void setOwnerEmail(String ownerEmail) {
        this.ownerEmail = ownerEmail;
    }
    public String getExecutionDirectory() {
        return executionDirectory;
    }
    public void setExecutionDirectory(String executionDirectory) {
        this.executionDirectory = executionDirectory;
    }
    public List<String> getSbatchArguments() {
        return sbatchArguments;
    }
    public void setSbatchArguments(List<String> sbatchArguments) {
        this.sbatchArguments = sbatchArguments;
    }
    public JobScript getJobScript() {
        return jobScript;
    }
    public void setJobScript(JobScript jobScript) {
        this.jobScript = jobScript;
    }
}
