package io.omnivector.jobbergate.agent.schedulers.parsers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import io.omnivector.jobbergate.agent.exceptions.QueryException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;
import io.omnivector.jobbergate.agent.model.SchedulerJobInfo;
import io.omnivector.jobbergate.agent.model.enumerations.SlurmJobState;

/** Parse the key=value record printed by "scontrol show job &lt;id&gt;".
 * 
 * <p>The grammar is applied line by line.  A line is split on whitespace
 * into tokens.  A token of the form Key=Value starts a pair, where Key 
 * begins with a letter and continues with letters, digits, '_', ':' or '/'
 * and Value is everything after the first '='.  A token without a valid 
 * key continues the value of the pair before it on the same line, joined
 * by one space, which is how values such as job names with spaces survive.
 * A line whose first token is not a pair is noise and is skipped entirely.
 * A blank line after at least one pair ends a record.
 * 
 * <p>Querying an array job prints one record per task, each with its own 
 * JobId and the requested id in ArrayJobId.  The first task that is still
 * queued or running describes the array; once every task has finished the
 * record for the array's own id does, or failing that the first task.  A 
 * task id of the form &lt;array&gt;_&lt;task&gt; selects the record with 
 * that ArrayJobId and ArrayTaskId.
 * 
 * <p>JobState is required.  Reason is optional and the placeholder values
 * slurm uses for "no reason" are dropped.  A record without a JobId is 
 * accepted only when it comes first, as happens with truncated output.
 */
public final class ScontrolOutputParser 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Well-known keys.
    public static final String KEY_JOB_ID    = "JobId";
    public static final String KEY_JOB_STATE = "JobState";
    public static final String KEY_REASON    = "Reason";
    public static final String KEY_ARRAY_JOB_ID  = "ArrayJobId";
    public static final String KEY_ARRAY_TASK_ID = "ArrayTaskId";
    
    // Token grammar.
    private static final Pattern PAIR_PATTERN = Pattern.compile("([A-Za-z][A-Za-z0-9_:/]*)=(.*)");
    private static final Pattern LINE_PATTERN = Pattern.compile("\\R");
    private static final Pattern SPACE_PATTERN = Pattern.compile("\\s+");
    
    // Text slurm prints for an id it does not know.
    private static final Pattern NOT_FOUND_PATTERN = 
        Pattern.compile("invalid job id specified", Pattern.CASE_INSENSITIVE);
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private ScontrolOutputParser() {}
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* parse:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Parse scontrol output into a job status record.
     * 
     * @param schedulerJobId the id that was queried
     * @param output the scontrol stdout text
     * @return the status record
     * @throws QueryException if the output does not conform to the grammar 
     */
    public static SchedulerJobInfo parse(String schedulerJobId, String output)
     throws QueryException
    {
        if (StringUtils.isBlank(output)) {
            String msg = MsgUtils.getMsg("AGENT_SCONTROL_NO_RESULT", schedulerJobId);
            throw new QueryException(msg);
        }
        
        // Collect the records.
        List<Map<String,String>> records = parseRecords(output);
        if (records.isEmpty()) {
            String msg = MsgUtils.getMsg("AGENT_SCONTROL_UNPARSEABLE", schedulerJobId, 
                                         StringUtils.abbreviate(output.strip(), 1024));
            throw new QueryException(msg);
        }
        
        // Make sure we got the record we asked for.
        Map<String,String> fields = selectRecord(schedulerJobId, records);
        if (fields == null) {
            String msg = MsgUtils.getMsg("AGENT_SCONTROL_ID_MISMATCH", schedulerJobId, 
                                         records.get(0).get(KEY_JOB_ID));
            throw new QueryException(msg);
        }
        
        // The state is the whole point.
        String state = StringUtils.trimToNull(fields.get(KEY_JOB_STATE));
        if (state == null) {
            String msg = MsgUtils.getMsg("AGENT_SCONTROL_MISSING_KEY", schedulerJobId, KEY_JOB_STATE);
            throw new QueryException(msg);
        }
        
        return new SchedulerJobInfo(schedulerJobId, state, normalizeReason(fields.get(KEY_REASON)), fields);
    }
    
    /* ---------------------------------------------------------------------- */
    /* parseFields:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Apply the pair grammar to the first record in the text.
     * 
     * @param output non-null command output
     * @return the pairs in the order encountered, possibly empty
     */
    public static Map<String,String> parseFields(String output)
    {
        var records = parseRecords(output);
        return records.isEmpty() ? new LinkedHashMap<String,String>() : records.get(0);
    }
    
    /* ---------------------------------------------------------------------- */
    /* parseRecords:                                                          */
    /* ---------------------------------------------------------------------- */
    /** Apply the pair grammar to every record in the text.
     * 
     * @param output non-null command output
     * @return the non-empty records in output order, possibly none
     */
    public static List<Map<String,String>> parseRecords(String output)
    {
        var records = new ArrayList<Map<String,String>>();
        var fields = new LinkedHashMap<String,String>();
        for (String line : LINE_PATTERN.split(output)) {
            // A blank line ends the current record.
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                if (!fields.isEmpty()) {
                    records.add(fields);
                    fields = new LinkedHashMap<String,String>();
                }
                continue;
            }
            
            // Walk the tokens.  Continuations only apply on the same line.
            String lastKey = null;
            boolean first = true;
            for (String token : SPACE_PATTERN.split(stripped)) {
                var m = PAIR_PATTERN.matcher(token);
                if (m.matches()) {
                    // Keep the first occurrence of a key and ignore any 
                    // continuation tokens of a duplicate.
                    String key = m.group(1);
                    if (fields.containsKey(key)) lastKey = null;
                      else {fields.put(key, m.group(2)); lastKey = key;}
                }
                else if (first) break;  // noise line
                else if (lastKey != null) fields.put(lastKey, fields.get(lastKey) + " " + token);
                first = false;
            }
        }
        if (!fields.isEmpty()) records.add(fields);
        return records;
    }
    
    /* ---------------------------------------------------------------------- */
    /* isJobNotFound:                                                         */
    /* ---------------------------------------------------------------------- */
    /** Determine whether command output is slurm's report of an unknown id. */
    public static boolean isJobNotFound(String text)
    {
        return text != null && NOT_FOUND_PATTERN.matcher(text).find();
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* selectRecord:                                                          */
    /* ---------------------------------------------------------------------- */
    /** Pick the record that describes the requested id, or null if none does. */
    private static Map<String,String> selectRecord(String schedulerJobId, List<Map<String,String>> records)
    {
        // The tasks of an array queried by its own id.
        var tasks = new ArrayList<Map<String,String>>();
        for (var record : records) 
            if (schedulerJobId.equals(record.get(KEY_ARRAY_JOB_ID))) tasks.add(record);
        if (!tasks.isEmpty()) {
            for (var task : tasks) 
                if (!SlurmJobState.toJobState(task.get(KEY_JOB_STATE)).isTerminal()) return task;
            for (var task : tasks) 
                if (schedulerJobId.equals(task.get(KEY_JOB_ID))) return task;
            return tasks.get(0);
        }
        
        // An ordinary job or a single array task.
        for (var record : records) {
            if (schedulerJobId.equals(record.get(KEY_JOB_ID))) return record;
            String taskId = record.get(KEY_ARRAY_JOB_ID) + "_" + record.get(KEY_ARRAY_TASK_ID);
            if (record.containsKey(KEY_ARRAY_TASK_ID) && schedulerJobId.equals(taskId)) return record;
        }
        
        // Truncated output can lose the id.
        if (!records.get(0).containsKey(KEY_JOB_ID)) return records.get(0);
        return null;
    }
    
    /* ---------------------------------------------------------------------- */
    /* normalizeReason:                                                       */
    /* ---------------------------------------------------------------------- */
    private static String normalizeReason(String reason)
    {
        reason = StringUtils.trimToNull(reason);
        if (reason == null || reason.equals("None") || reason.equals("(null)")) return null;
        return reason;
    }
}
