package io.omnivector.jobbergate.agent.schedulers.parsers;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import io.omnivector.jobbergate.agent.exceptions.SubmissionException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;

/** Extract the job id that slurm assigned from sbatch output.  Two line 
 * formats are recognized:
 * 
 * <pre>
 *     1234                       (sbatch --parsable)
 *     1234;cluster_name          (sbatch --parsable on a federated/multi-cluster site)
 *     Submitted batch job 1234   (plain sbatch)
 * </pre>
 * 
 * Leading and trailing whitespace on a line is ignored.  Anything else on
 * the line means the line does not match.
 */
public final class SbatchOutputParser 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // The regex groups the numeric ID in each recognized form.
    private static final Pattern PARSABLE_RESULT_PATTERN = Pattern.compile("\\s*(\\d+)(?:[;,]\\S+)?\\s*");
    private static final Pattern SLURM_RESULT_PATTERN = Pattern.compile("\\s*Submitted batch job (\\d+)\\s*");
    private static final Pattern LINE_PATTERN = Pattern.compile("\\R");
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private SbatchOutputParser() {}
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* getSlurmId:                                                            */
    /* ---------------------------------------------------------------------- */
    /** Extract the slurm id from the output of an sbatch command.  If unable to find
     * the id, this method throws an exception.  The slurm id is usually the last line
     * of output, but to accommodate installations that write other information after 
     * the sbatch output, we do a reverse search on the output lines.  The first line
     * that matches sbatch output text is the one we run with.  
     * 
     * @param output the sbatch stdout text
     * @param cmd the actual sbatch command
     * @return the id slurm assigned to this job
     * @throws SubmissionException if the slurm id cannot be recovered
     */
    public static String getSlurmId(String output, String cmd) 
     throws SubmissionException
    {
        // We have a problem if there's no result at all.
        if (StringUtils.isBlank(output)) {
            String msg = MsgUtils.getMsg("AGENT_SBATCH_NO_RESULT", cmd);
            throw new SubmissionException(msg);
        }
        
        // There may be banner information in the result.  We strip 
        // whitespace and break the output into individual lines.
        output = output.strip();
        String[] lines = LINE_PATTERN.split(output);
        
        // Iterate in reverse order through the lines of output
        // looking for the first slurm result match.
        for (int i = lines.length - 1; i >= 0; i--) {
            String slurmId = matchLine(lines[i]);
            if (slurmId != null) return slurmId;
        }
        
        // We didn't find the result line.
        String msg = MsgUtils.getMsg("AGENT_SBATCH_INVALID_RESULT", cmd, StringUtils.abbreviate(output, 1024));
        throw new SubmissionException(msg);
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* matchLine:                                                             */
    /* ---------------------------------------------------------------------- */
    private static String matchLine(String line)
    {
        Matcher m = PARSABLE_RESULT_PATTERN.matcher(line);
        if (m.matches()) return m.group(1);
        m = SLURM_RESULT_PATTERN.matcher(line);
        if (m.matches()) return m.group(1);
        return null;
    }
}
