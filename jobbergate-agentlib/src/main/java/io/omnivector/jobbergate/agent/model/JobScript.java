package io.omnivector.jobbergate.agent.model;

import java.util.ArrayList;
import java.util.List;

import io.omnivector.jobbergate.agent.model.enumerations.JobFileType;

public class JobScript 
{
    private List<JobScriptFile> files = new ArrayList<JobScriptFile>();
    
    // Constructors.
    public JobScript() {}
    
    /** Return the first entrypoint file or null if there isn't one. */
    public JobScriptFile getEntrypoint()
    {
        if (files == null) return null;
        for (var file : files) 
            if (file != null && file.getFileType() == JobFileType.ENTRYPOINT) return file;
        return null;
    }
    
    /** Return the support files, possibly an empty list. */
    public List<JobScriptFile> getSupportFiles()
    {
        var list = new ArrayList<JobScriptFile>();
        if (files == null) return list;
        for (var file : files) 
            if (file != null && file.getFileType() == JobFileType.SUPPORT) list.add(file);
        return list;
    }
    
    // Accessors
    public List<JobScriptFile> getFiles() {
        return files;
    }
    public void setFiles(List<JobScriptFile> files) {
        this.files = files;
    }
}
