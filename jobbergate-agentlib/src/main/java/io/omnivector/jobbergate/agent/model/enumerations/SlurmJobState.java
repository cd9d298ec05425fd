package io.omnivector.jobbergate.agent.model.enumerations;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/** The job states Slurm reports in the JobState field of scontrol output, 
 * each paired with the internal state it maps to.  Some states also carry
 * a default reason that is reported when Slurm itself gives none.  For
 * TIMEOUT the default reason is always reported, since Slurm's own reason
 * (usually TimeLimit) is less useful upstream than the fixed "timeout".
 * 
 * New Slurm releases occasionally add states.  Those are not listed here
 * and translate to {@link JobState#UNRECOGNIZED} through {@link #toJobState(String)}.
 */
public enum SlurmJobState 
{
    // Queued.
    PENDING(JobState.QUEUED),
    CONFIGURING(JobState.QUEUED),
    REQUEUED(JobState.QUEUED),
    REQUEUE_HOLD(JobState.QUEUED),
    REQUEUE_FED(JobState.QUEUED),
    RESV_DEL_HOLD(JobState.QUEUED),
    
    // Running or otherwise still allocated.
    RUNNING(JobState.RUNNING),
    COMPLETING(JobState.RUNNING),
    SUSPENDED(JobState.RUNNING),
    STOPPED(JobState.RUNNING),
    RESIZING(JobState.RUNNING),
    SIGNALING(JobState.RUNNING),
    STAGE_OUT(JobState.RUNNING),
    
    // Terminal.
    COMPLETED(JobState.COMPLETED),
    CANCELLED(JobState.CANCELLED),
    FAILED(JobState.FAILED),
    NODE_FAIL(JobState.FAILED, "node failure"),
    OUT_OF_MEMORY(JobState.FAILED, "out of memory"),
    BOOT_FAIL(JobState.FAILED, "boot failure"),
    DEADLINE(JobState.FAILED, "deadline"),
    PREEMPTED(JobState.FAILED, "preempted"),
    SPECIAL_EXIT(JobState.FAILED),
    REVOKED(JobState.FAILED),
    TIMEOUT(JobState.FAILED, "timeout", true);
    
    // ---- Fields
    private final JobState _jobState;
    private final String   _defaultReason;
    private final boolean  _reasonFixed;
    
    // ---- Constructors
    SlurmJobState(JobState jobState) {this(jobState, null, false);}
    SlurmJobState(JobState jobState, String defaultReason) {this(jobState, defaultReason, false);}
    SlurmJobState(JobState jobState, String defaultReason, boolean reasonFixed)
    {
        _jobState = jobState;
        _defaultReason = defaultReason;
        _reasonFixed = reasonFixed;
    }
    
    // ---- Instance Methods
    public JobState getJobState() {return _jobState;}
    public String getDefaultReason() {return _defaultReason;}
    public boolean isReasonFixed() {return _reasonFixed;}
    
    // ---- Static Methods
    /** Reduce a raw state to its canonical token.  Slurm sometimes decorates
     * states, as in "CANCELLED by 1000" or "RUNNING+", so only the leading
     * run of letters and underscores is kept.
     * 
     * @param raw the state text as reported, possibly null
     * @return the upper case canonical token, or null if none can be found
     */
    public static String normalize(String raw)
    {
        if (StringUtils.isBlank(raw)) return null;
        String s = raw.strip().toUpperCase(Locale.ROOT);
        int end = 0;
        while (end < s.length() && (Character.isLetter(s.charAt(end)) || s.charAt(end) == '_')) end++;
        return end == 0 ? null : s.substring(0, end);
    }
    
    /** Look up a raw state.
     * 
     * @param raw the state text as reported
     * @return the matching constant or null if the state is not recognized
     */
    public static SlurmJobState fromRaw(String raw)
    {
        String token = normalize(raw);
        if (token == null) return null;
        try {return SlurmJobState.valueOf(token);}
            catch (IllegalArgumentException e) {return null;}
    }
    
    /** Map a raw state directly to an internal state.  Unknown states map
     * to {@link JobState#UNRECOGNIZED}, never to an exception.
     * 
     * @param raw the state text as reported
     * @return the non-null internal state
     */
    public static JobState toJobState(String raw)
    {
        var state = fromRaw(raw);
        return state == null ? JobState.UNRECOGNIZED : state.getJobState();
    }
}
