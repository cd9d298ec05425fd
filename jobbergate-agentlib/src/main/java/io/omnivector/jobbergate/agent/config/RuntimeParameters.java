package io.omnivector.jobbergate.agent.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.exceptions.AgentException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;

/** The agent's complete static configuration.  An instance is built once at
 * start up and handed to each component's constructor; no component reads
 * the environment on its own.
 * 
 * Values are resolved from, in increasing precedence, built-in defaults, an
 * optional properties file and the process environment.  Property file keys
 * and environment variable names are identical.  All values are validated 
 * during construction, so a successfully constructed instance is always 
 * usable.
 */
public final class RuntimeParameters 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(RuntimeParameters.class);
    
    // Configuration file location.
    public static final String CONFIG_FILE_ENV     = "JOBBERGATE_AGENT_CONFIG_FILE";
    public static final String DEFAULT_CONFIG_FILE = "/etc/jobbergate-agent/agent.properties";
    
    // Parameter names.
    public static final String BASE_API_URL                = "JOBBERGATE_AGENT_BASE_API_URL";
    public static final String ACCESS_TOKEN                = "JOBBERGATE_AGENT_ACCESS_TOKEN";
    public static final String REQUESTS_TIMEOUT_SECONDS    = "JOBBERGATE_AGENT_REQUESTS_TIMEOUT_SECONDS";
    public static final String MAX_PAGES_PER_CYCLE         = "JOBBERGATE_AGENT_MAX_PAGES_PER_CYCLE";
    public static final String ITEMS_PER_PAGE              = "JOBBERGATE_AGENT_ITEMS_PER_PAGE";
    public static final String SBATCH_PATH                 = "JOBBERGATE_AGENT_SBATCH_PATH";
    public static final String SCONTROL_PATH               = "JOBBERGATE_AGENT_SCONTROL_PATH";
    public static final String SCANCEL_PATH                = "JOBBERGATE_AGENT_SCANCEL_PATH";
    public static final String SUBPROCESS_TIMEOUT_SECONDS  = "JOBBERGATE_AGENT_SUBPROCESS_TIMEOUT_SECONDS";
    public static final String X_SLURM_USER_NAME           = "JOBBERGATE_AGENT_X_SLURM_USER_NAME";
    public static final String SINGLE_USER_SUBMITTER       = "JOBBERGATE_AGENT_SINGLE_USER_SUBMITTER";
    public static final String DEFAULT_SLURM_WORK_DIR      = "JOBBERGATE_AGENT_DEFAULT_SLURM_WORK_DIR";
    public static final String WRITE_SUBMISSION_FILES      = "JOBBERGATE_AGENT_WRITE_SUBMISSION_FILES";
    public static final String SUBMISSION_CACHE_TTL_SECONDS = "JOBBERGATE_AGENT_SUBMISSION_CACHE_TTL_SECONDS";
    public static final String TASK_JOBS_INTERVAL_SECONDS  = "JOBBERGATE_AGENT_TASK_JOBS_INTERVAL_SECONDS";
    public static final String TASK_SUBMISSIONS_INTERVAL_SECONDS = "JOBBERGATE_AGENT_TASK_SUBMISSIONS_INTERVAL_SECONDS";
    public static final String TASK_STATUS_INTERVAL_SECONDS = "JOBBERGATE_AGENT_TASK_STATUS_INTERVAL_SECONDS";
    public static final String TASK_HEALTH_INTERVAL_SECONDS = "JOBBERGATE_AGENT_TASK_HEALTH_INTERVAL_SECONDS";
    
    // The placeholder substituted in the default working directory.
    public static final String USERNAME_PLACEHOLDER = "{username}";
    
    // Interval bounds shared by all tasks.
    private static final int MIN_TASK_INTERVAL_SECONDS = 10;
    private static final int MAX_TASK_INTERVAL_SECONDS = 3600;
    
    // The shortest cache TTL that still spans a few report retries.
    private static final int MIN_CACHE_TTL_SECONDS = 60;
    
    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    // Remote API.
    private final URI      _baseApiUrl;
    private final String   _accessToken;
    private final Duration _requestsTimeout;
    private final int      _maxPagesPerCycle;
    private final int      _itemsPerPage;
    
    // Slurm commands.
    private final Path     _sbatchPath;
    private final Path     _scontrolPath;
    private final Path     _scancelPath;
    private final Duration _subprocessTimeout;
    
    // Submission.
    private final String   _xSlurmUserName;
    private final String   _singleUserSubmitter;
    private final String   _defaultSlurmWorkDir;
    private final boolean  _writeSubmissionFiles;
    private final Duration _submissionCacheTtl;
    
    // Task intervals.
    private final Duration _submissionsInterval;
    private final Duration _statusInterval;
    private final Duration _healthInterval;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Build and validate the parameters from a flat name/value map.  Missing
     * names take their defaults.
     * 
     * @param values the configured values keyed by parameter name
     * @throws AgentException if any value is malformed or out of range
     */
    public RuntimeParameters(Map<String,String> values)
     throws AgentException
    {
        if (values == null) values = Collections.emptyMap();
        
        // ------------------------- Remote API -----------------------------
        _baseApiUrl = parseUrl(values, BASE_API_URL, "https://apis.vantagehpc.io");
        _accessToken = StringUtils.trimToNull(values.get(ACCESS_TOKEN));
        _requestsTimeout = Duration.ofSeconds(parseInt(values, REQUESTS_TIMEOUT_SECONDS, 15, 1, Integer.MAX_VALUE));
        _maxPagesPerCycle = parseInt(values, MAX_PAGES_PER_CYCLE, 5, 1, Integer.MAX_VALUE);
        _itemsPerPage = parseInt(values, ITEMS_PER_PAGE, 100, 1, 100);
        
        // ------------------------- Slurm Commands -------------------------
        _sbatchPath = parseAbsolutePath(values, SBATCH_PATH, "/usr/bin/sbatch");
        _scontrolPath = parseAbsolutePath(values, SCONTROL_PATH, "/usr/bin/scontrol");
        _scancelPath = parseAbsolutePath(values, SCANCEL_PATH, "/usr/bin/scancel");
        _subprocessTimeout = Duration.ofSeconds(parseInt(values, SUBPROCESS_TIMEOUT_SECONDS, 60, 1, Integer.MAX_VALUE));
        
        // ------------------------- Submission -----------------------------
        _xSlurmUserName = parseNonBlank(values, X_SLURM_USER_NAME, "ubuntu");
        _singleUserSubmitter = parseNonBlank(values, SINGLE_USER_SUBMITTER, _xSlurmUserName);
        _defaultSlurmWorkDir = parseNonBlank(values, DEFAULT_SLURM_WORK_DIR, "/home/" + USERNAME_PLACEHOLDER);
        _writeSubmissionFiles = parseBoolean(values, WRITE_SUBMISSION_FILES, true);
        _submissionCacheTtl = Duration.ofSeconds(
            parseInt(values, SUBMISSION_CACHE_TTL_SECONDS, 43200, MIN_CACHE_TTL_SECONDS, Integer.MAX_VALUE));
        
        // ------------------------- Task Intervals -------------------------
        // The specific intervals default to the general jobs interval.
        int jobsInterval = parseInt(values, TASK_JOBS_INTERVAL_SECONDS, 60, 
                                    MIN_TASK_INTERVAL_SECONDS, MAX_TASK_INTERVAL_SECONDS);
        _submissionsInterval = Duration.ofSeconds(parseInt(values, TASK_SUBMISSIONS_INTERVAL_SECONDS, jobsInterval,
                                                  MIN_TASK_INTERVAL_SECONDS, MAX_TASK_INTERVAL_SECONDS));
        _statusInterval = Duration.ofSeconds(parseInt(values, TASK_STATUS_INTERVAL_SECONDS, jobsInterval,
                                             MIN_TASK_INTERVAL_SECONDS, MAX_TASK_INTERVAL_SECONDS));
        _healthInterval = Duration.ofSeconds(parseInt(values, TASK_HEALTH_INTERVAL_SECONDS, jobsInterval,
                                             MIN_TASK_INTERVAL_SECONDS, MAX_TASK_INTERVAL_SECONDS));
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* load:                                                                  */
    /* ---------------------------------------------------------------------- */
    /** Assemble the parameters from the configuration file, if any, and the
     * process environment.
     * 
     * @return the validated parameters
     * @throws AgentException if the file cannot be read or a value is invalid
     */
    public static RuntimeParameters load() throws AgentException
    {
        return load(System.getenv());
    }
    
    /* ---------------------------------------------------------------------- */
    /* load:                                                                  */
    /* ---------------------------------------------------------------------- */
    /** Assemble the parameters from the configuration file named in env, if
     * any, overlaid with the env values themselves.
     * 
     * @param env the environment to consult
     * @return the validated parameters
     * @throws AgentException if the file cannot be read or a value is invalid
     */
    public static RuntimeParameters load(Map<String,String> env) throws AgentException
    {
        // File values come first so the environment can override them.
        var values = new HashMap<String,String>();
        Path configFile = getConfigFile(env);
        if (configFile != null) {
            values.putAll(readPropertiesFile(configFile));
            _log.info(MsgUtils.getMsg("AGENT_CONFIG_FILE_LOADED", configFile));
        }
        
        // Only our own variables are of interest.
        for (var entry : env.entrySet())
            if (entry.getKey().startsWith("JOBBERGATE_AGENT_")) 
                values.put(entry.getKey(), entry.getValue());
        
        return new RuntimeParameters(values);
    }
    
    /* ---------------------------------------------------------------------- */
    /* getShutdownGracePeriod:                                                */
    /* ---------------------------------------------------------------------- */
    /** The time to let in-flight task runs finish on shutdown.  A run blocks
     * on at most one subprocess and one API call at a time.
     */
    public Duration getShutdownGracePeriod()
    {
        return _subprocessTimeout.plus(_requestsTimeout).plusSeconds(5);
    }
    
    /* ---------------------------------------------------------------------- */
    /* toString:                                                              */
    /* ---------------------------------------------------------------------- */
    @Override
    public String toString()
    {
        // Never write the token.
        var buf = new StringBuilder(512);
        buf.append("RuntimeParameters[");
        buf.append("baseApiUrl=").append(_baseApiUrl);
        buf.append(", accessToken=").append(_accessToken == null ? "<unset>" : "<redacted>");
        buf.append(", requestsTimeout=").append(_requestsTimeout);
        buf.append(", maxPagesPerCycle=").append(_maxPagesPerCycle);
        buf.append(", itemsPerPage=").append(_itemsPerPage);
        buf.append(", sbatchPath=").append(_sbatchPath);
        buf.append(", scontrolPath=").append(_scontrolPath);
        buf.append(", scancelPath=").append(_scancelPath);
        buf.append(", subprocessTimeout=").append(_subprocessTimeout);
        buf.append(", singleUserSubmitter=").append(_singleUserSubmitter);
        buf.append(", defaultSlurmWorkDir=").append(_defaultSlurmWorkDir);
        buf.append(", writeSubmissionFiles=").append(_writeSubmissionFiles);
        buf.append(", submissionCacheTtl=").append(_submissionCacheTtl);
        buf.append(", submissionsInterval=").append(_submissionsInterval);
        buf.append(", statusInterval=").append(_statusInterval);
        buf.append(", healthInterval=").append(_healthInterval);
        buf.append("]");
        return buf.toString();
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* getConfigFile:                                                         */
    /* ---------------------------------------------------------------------- */
    private static Path getConfigFile(Map<String,String> env) throws AgentException
    {
        // An explicitly named file must exist.
        String explicit = StringUtils.trimToNull(env.get(CONFIG_FILE_ENV));
        if (explicit != null) {
            var path = Path.of(explicit);
            if (!Files.isReadable(path)) {
                String msg = MsgUtils.getMsg("AGENT_CONFIG_FILE_UNREADABLE", path);
                throw new AgentException(msg);
            }
            return path;
        }
        
        // The default file is optional.
        var path = Path.of(DEFAULT_CONFIG_FILE);
        return Files.isReadable(path) ? path : null;
    }
    
    /* ---------------------------------------------------------------------- */
    /* readPropertiesFile:                                                    */
    /* ---------------------------------------------------------------------- */
    private static Map<String,String> readPropertiesFile(Path path) throws AgentException
    {
        var props = new Properties();
        try (InputStream in = new FileInputStream(path.toFile())) {props.load(in);}
            catch (IOException e) {
                String msg = MsgUtils.getMsg("AGENT_CONFIG_FILE_UNREADABLE", path);
                throw new AgentException(msg, e);
            }
        
        var values = new HashMap<String,String>();
        for (String name : props.stringPropertyNames()) values.put(name, props.getProperty(name));
        return values;
    }
    
    /* ---------------------------------------------------------------------- */
    /* parseInt:                                                              */
    /* ---------------------------------------------------------------------- */
    private static int parseInt(Map<String,String> values, String name, int defaultValue,
                                int min, int max)
     throws AgentException
    {
        String s = StringUtils.trimToNull(values.get(name));
        if (s == null) return defaultValue;
        
        int value;
        try {value = Integer.parseInt(s);}
            catch (NumberFormatException e) {
                String msg = MsgUtils.getMsg("AGENT_CONFIG_INVALID_INTEGER", name, s);
                throw new AgentException(msg, e);
            }
        
        if (value < min || value > max) {
            String msg = MsgUtils.getMsg("AGENT_CONFIG_OUT_OF_RANGE", name, value, min, max);
            throw new AgentException(msg);
        }
        return value;
    }
    
    /* ---------------------------------------------------------------------- */
    /* parseBoolean:                                                          */
    /* ---------------------------------------------------------------------- */
    private static boolean parseBoolean(Map<String,String> values, String name, boolean defaultValue)
     throws AgentException
    {
        String s = StringUtils.trimToNull(values.get(name));
        if (s == null) return defaultValue;
        
        // Be strict, a typo should not silently become false.
        if (s.equalsIgnoreCase("true") || s.equals("1")) return true;
        if (s.equalsIgnoreCase("false") || s.equals("0")) return false;
        String msg = MsgUtils.getMsg("AGENT_CONFIG_INVALID_BOOLEAN", name, s);
        throw new AgentException(msg);
    }
    
    /* ---------------------------------------------------------------------- */
    /* parseNonBlank:                                                         */
    /* ---------------------------------------------------------------------- */
    private static String parseNonBlank(Map<String,String> values, String name, String defaultValue)
     throws AgentException
    {
        // Absent means default, present but blank is an error.
        if (!values.containsKey(name)) return defaultValue;
        String s = StringUtils.trimToNull(values.get(name));
        if (s == null) {
            String msg = MsgUtils.getMsg("AGENT_CONFIG_BLANK_VALUE", name);
            throw new AgentException(msg);
        }
        return s;
    }
    
    /* ---------------------------------------------------------------------- */
    /* parseAbsolutePath:                                                     */
    /* ---------------------------------------------------------------------- */
    private static Path parseAbsolutePath(Map<String,String> values, String name, String defaultValue)
     throws AgentException
    {
        String s = parseNonBlank(values, name, defaultValue);
        var path = Path.of(s);
        if (!path.isAbsolute()) {
            String msg = MsgUtils.getMsg("AGENT_CONFIG_PATH_NOT_ABSOLUTE", name, s);
            throw new AgentException(msg);
        }
        return path;
    }
    
    /* ---------------------------------------------------------------------- */
    /* parseUrl:                                                              */
    /* ---------------------------------------------------------------------- */
    private static URI parseUrl(Map<String,String> values, String name, String defaultValue)
     throws AgentException
    {
        String s = parseNonBlank(values, name, defaultValue);
        
        // Relative API paths are resolved against the base, so it must end in a slash.
        if (!s.endsWith("/")) s += "/";
        URI uri;
        try {uri = URI.create(s);}
            catch (IllegalArgumentException e) {
                String msg = MsgUtils.getMsg("AGENT_CONFIG_INVALID_URL", name, s);
                throw new AgentException(msg, e);
            }
        
        String scheme = uri.getScheme();
        if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            String msg = MsgUtils.getMsg("AGENT_CONFIG_INVALID_URL", name, s);
            throw new AgentException(msg);
        }
        return uri;
    }
    
    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public URI getBaseApiUrl() {return _baseApiUrl;}
    public String getAccessToken() {return _accessToken;}
    public Duration getRequestsTimeout() {return _requestsTimeout;}
    public int getMaxPagesPerCycle() {return _maxPagesPerCycle;}
    public int getItemsPerPage() {return _itemsPerPage;}
    public Path getSbatchPath() {return _sbatchPath;}
    public Path getScontrolPath() {return _scontrolPath;}
    public Path getScancelPath() {return _scancelPath;}
    public Duration getSubprocessTimeout() {return _subprocessTimeout;}
    public String getXSlurmUserName() {return _xSlurmUserName;}
    public String getSingleUserSubmitter() {return _singleUserSubmitter;}
    public String getDefaultSlurmWorkDir() {return _defaultSlurmWorkDir;}
    public boolean isWriteSubmissionFiles() {return _writeSubmissionFiles;}
    public Duration getSubmissionCacheTtl() {return _submissionCacheTtl;}
    public Duration getSubmissionsInterval() {return _submissionsInterval;}
    public Duration getStatusInterval() {return _statusInterval;}
    public Duration getHealthInterval() {return _healthInterval;}
}
