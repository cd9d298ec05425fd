package io.omnivector.jobbergate.agent.reconcilers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.client.JobbergateApi;
import io.omnivector.jobbergate.agent.config.RuntimeParameters;
import io.omnivector.jobbergate.agent.exceptions.FetchException;
import io.omnivector.jobbergate.agent.exceptions.SubmissionException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;
import io.omnivector.jobbergate.agent.model.JobScriptFile;
import io.omnivector.jobbergate.agent.model.PendingJobSubmission;

/** Prepares the files of a pending job submission for the scheduler.  All
 * failures are submission exceptions whose text becomes the rejection 
 * message the owner sees.
 */
public final class JobFileManager 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(JobFileManager.class);
    
    // Staging directory name prefix, completed with the submission id.
    private static final String STAGING_PREFIX = "jobbergate-submission-";

    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    private final JobbergateApi _api;
    private final String        _defaultWorkDirTemplate;
    private final boolean       _writeSubmissionFiles;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public JobFileManager(JobbergateApi api, RuntimeParameters parms)
    {
        this(api, parms.getDefaultSlurmWorkDir(), parms.isWriteSubmissionFiles());
    }
    
    public JobFileManager(JobbergateApi api, String defaultWorkDirTemplate, boolean writeSubmissionFiles)
    {
        _api = api;
        _defaultWorkDirTemplate = defaultWorkDirTemplate;
        _writeSubmissionFiles = writeSubmissionFiles;
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* resolveWorkDir:                                                        */
    /* ---------------------------------------------------------------------- */
    /** Determine and validate the directory the job runs in.  The submission's
     * own execution directory wins over the configured default.
     * 
     * @param job the pending submission
     * @param username the local user the job is submitted for
     * @return an absolute, existing, writable directory
     * @throws SubmissionException if the directory is unusable
     */
    public Path resolveWorkDir(PendingJobSubmission job, String username) throws SubmissionException
    {
        String dirName = StringUtils.isNotBlank(job.getExecutionDirectory()) ? job.getExecutionDirectory() :
                            _defaultWorkDirTemplate.replace(RuntimeParameters.USERNAME_PLACEHOLDER, username);
        
        Path workDir;
        try {workDir = Path.of(dirName);}
            catch (InvalidPathException e) {
                throw new SubmissionException(MsgUtils.getMsg("AGENT_WORKDIR_INVALID", dirName, e.getMessage()), e);
            }
        
        String problem = null;
        if (!workDir.isAbsolute()) problem = "not an absolute path";
          else if (!Files.isDirectory(workDir)) problem = "not an existing directory";
          else if (!Files.isWritable(workDir)) problem = "not writable";
        if (problem != null) 
            throw new SubmissionException(MsgUtils.getMsg("AGENT_WORKDIR_INVALID", workDir, problem));
        return workDir;
    }
    
    /* ---------------------------------------------------------------------- */
    /* stage:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Download the submission's files and lay them out for sbatch.  The 
     * caller must close the result once the scheduler has read the script.
     * 
     * @param job the pending submission
     * @param workDir the validated working directory
     * @return the staged files
     * @throws SubmissionException if the files cannot be retrieved or written
     */
    public StagedSubmission stage(PendingJobSubmission job, Path workDir) throws SubmissionException
    {
        // Find the script before doing any work.
        JobScriptFile entrypoint = job.getJobScript() == null ? null : job.getJobScript().getEntrypoint();
        if (entrypoint == null) 
            throw new SubmissionException(MsgUtils.getMsg("AGENT_NO_ENTRYPOINT", job.getId()));
        
        // Support files can only reach the job through the working directory.
        List<JobScriptFile> supportFiles = job.getJobScript().getSupportFiles();
        if (!supportFiles.isEmpty() && !_writeSubmissionFiles)
            throw new SubmissionException(MsgUtils.getMsg("AGENT_SUPPORT_FILES_NOT_ALLOWED", job.getId()));
        
        Path stagingDir;
        try {stagingDir = Files.createTempDirectory(STAGING_PREFIX + job.getId() + "-");}
            catch (IOException e) {
                String msg = MsgUtils.getMsg("AGENT_FILES_PROCESSING_ERROR", job.getId(), e.getMessage());
                throw new SubmissionException(msg, e);
            }
        
        // Clean up on any failure from here on.
        var staged = new ArrayList<Path>();
        try {
            for (var file : supportFiles) staged.add(download(file, stagingDir));
            Path script = download(entrypoint, stagingDir);
            
            if (_writeSubmissionFiles) {
                for (var path : staged) copyToWorkDir(path, workDir);
                script = copyToWorkDir(script, workDir);
            }
            if (_log.isDebugEnabled())
                _log.debug(MsgUtils.getMsg("AGENT_FILES_STAGED", job.getId(), script, staged.size()));
            return new StagedSubmission(job.getId(), stagingDir, script);
        }
        catch (FetchException | IOException e) {
            deleteQuietly(job.getId(), stagingDir);
            String msg = MsgUtils.getMsg("AGENT_FILES_PROCESSING_ERROR", job.getId(), e.getMessage());
            throw new SubmissionException(msg, e);
        }
        catch (SubmissionException | RuntimeException e) {
            deleteQuietly(job.getId(), stagingDir);
            throw e;
        }
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* download:                                                              */
    /* ---------------------------------------------------------------------- */
    private Path download(JobScriptFile file, Path dir) 
     throws FetchException, IOException, SubmissionException
    {
        String content = _api.retrieveFile(file);
        Path target = dir.resolve(safeFilename(file.getFilename()));
        Files.writeString(target, content == null ? "" : content, StandardCharsets.UTF_8);
        return target;
    }
    
    /* ---------------------------------------------------------------------- */
    /* copyToWorkDir:                                                         */
    /* ---------------------------------------------------------------------- */
    private static Path copyToWorkDir(Path file, Path workDir) throws IOException
    {
        Path target = workDir.resolve(file.getFileName());
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }
    
    /* ---------------------------------------------------------------------- */
    /* safeFilename:                                                          */
    /* ---------------------------------------------------------------------- */
    /** Reduce a file name to its last path element so that nothing is ever
     * written outside the target directory.
     */
    static String safeFilename(String filename) throws SubmissionException
    {
        Path name;
        try {name = StringUtils.isBlank(filename) ? null : Path.of(filename).getFileName();}
            catch (InvalidPathException e) {
                throw new SubmissionException(MsgUtils.getMsg("AGENT_INVALID_FILENAME", filename), e);
            }
        String result = name == null ? null : name.toString();
        if (result == null || result.equals("..") || result.equals("."))
            throw new SubmissionException(MsgUtils.getMsg("AGENT_INVALID_FILENAME", filename));
        return result;
    }
    
    /* ---------------------------------------------------------------------- */
    /* deleteQuietly:                                                         */
    /* ---------------------------------------------------------------------- */
    private static void deleteQuietly(long id, Path dir)
    {
        try {FileUtils.deleteDirectory(dir.toFile());}
            catch (IOException e) {
                _log.warn(MsgUtils.getMsg("AGENT_STAGING_CLEANUP_ERROR", id, dir, e.getMessage()));
            }
    }
}
