package io.omnivector.jobbergate.agent.model;

import java.util.List;

import io.omnivector.jobbergate.agent.model.enumerations.JobFileType;

public class JobScriptFile 
{
    // The api path prefix for downloading file content.
    private static final String JOB_SCRIPTS_SEGMENT = "job-scripts";
    private static final String UPLOAD_SEGMENT      = "upload";
    
    private long        parentId;
    private String      filename;
    private JobFileType fileType;
    
    // Constructors.
    public JobScriptFile() {}
    public JobScriptFile(long parentId, String filename, JobFileType fileType)
    {
        this.parentId = parentId;
        this.filename = filename;
        this.fileType = fileType;
    }
    
    /** The unencoded segments of the API path, relative to the base url, 
     * that serves this file.  The file name is a single segment whatever 
     * characters it contains.
     */
    public List<String> getPathSegments() 
    {
        return List.of("jobbergate", JOB_SCRIPTS_SEGMENT, Long.toString(parentId), UPLOAD_SEGMENT, 
                       String.valueOf(filename));
    }
    
    /** The API path in readable form, for messages. */
    public String getPath() {return String.join("/", getPathSegments());}
    
    // Accessors
    public long getParentId() {
        return parentId;
    }
    public void setParentId(long parentId) {
        this.parentId = parentId;
    }
    public String getFilename() {
        return filename;
    }
    public void setFilename(String filename) {
        this.filename = filename;
    }
    public JobFileType getFileType() {
        return fileType;
    }
    public void setFileType(JobFileType fileType) {
        this.fileType = fileType;
    }
}
