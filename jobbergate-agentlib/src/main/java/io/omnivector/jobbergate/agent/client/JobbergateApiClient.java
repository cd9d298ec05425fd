package io.omnivector.jobbergate.agent.client;

import java.io.Closeable;
import java.io.IOException;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.methods.HttpEntityEnclosingRequestBase;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.reflect.TypeToken;

import io.omnivector.jobbergate.agent.config.RuntimeParameters;
import io.omnivector.jobbergate.agent.exceptions.FetchException;
import io.omnivector.jobbergate.agent.exceptions.ReportException;
import io.omnivector.jobbergate.agent.i18n.MsgUtils;
import io.omnivector.jobbergate.agent.model.ActiveJobSubmission;
import io.omnivector.jobbergate.agent.model.JobScriptFile;
import io.omnivector.jobbergate.agent.model.JobStatusUpdate;
import io.omnivector.jobbergate.agent.model.ListResponseEnvelope;
import io.omnivector.jobbergate.agent.model.PendingJobSubmission;
import io.omnivector.jobbergate.agent.model.SchedulerJobInfo;
import io.omnivector.jobbergate.agent.utils.AgentGsonUtils;

/** Jobbergate API client built on Apache HttpClient.  One instance is shared
 * by all agent tasks; the underlying connection manager is thread-safe.
 */
public final class JobbergateApiClient 
 implements JobbergateApi, Closeable
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(JobbergateApiClient.class);
    
    // Endpoint paths relative to the base url.
    public static final String PENDING_PATH   = "jobbergate/job-submissions/agent/pending";
    public static final String ACTIVE_PATH    = "jobbergate/job-submissions/agent/active";
    public static final String SUBMITTED_PATH = "jobbergate/job-submissions/agent/submitted";
    public static final String REJECTED_PATH  = "jobbergate/job-submissions/agent/rejected";
    public static final String UPDATE_PATH    = "jobbergate/job-submissions/agent/";
    public static final String HEALTH_PATH    = "jobbergate/clusters/status";
    
    // Longest response body excerpt put in messages.
    private static final int MAX_BODY_EXCERPT = 512;
    
    private static final String BEARER_PREFIX = "Bearer ";

    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    private final URI                 _baseUrl;
    private final String              _accessToken;
    private final int                 _maxPages;
    private final int                 _pageSize;
    private final CloseableHttpClient _httpClient;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* constructor:                                                           */
    /* ---------------------------------------------------------------------- */
    public JobbergateApiClient(RuntimeParameters parms)
    {
        _baseUrl = parms.getBaseApiUrl();
        _accessToken = parms.getAccessToken();
        _maxPages = parms.getMaxPagesPerCycle();
        _pageSize = parms.getItemsPerPage();
        
        // Every phase of a request is bounded by the same timeout.
        int timeoutMillis = Math.toIntExact(parms.getRequestsTimeout().toMillis());
        var requestConfig = RequestConfig.custom()
                              .setConnectTimeout(timeoutMillis)
                              .setConnectionRequestTimeout(timeoutMillis)
                              .setSocketTimeout(timeoutMillis)
                              .build();
        _httpClient = HttpClients.custom()
                        .setDefaultRequestConfig(requestConfig)
                        .useSystemProperties()
                        .build();
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* fetchPendingSubmissions:                                               */
    /* ---------------------------------------------------------------------- */
    @Override
    public List<PendingJobSubmission> fetchPendingSubmissions() throws FetchException
    {
        return fetchAllPages(PENDING_PATH, PendingJobSubmission.class);
    }
    
    /* ---------------------------------------------------------------------- */
    /* fetchActiveSubmissions:                                                */
    /* ---------------------------------------------------------------------- */
    @Override
    public List<ActiveJobSubmission> fetchActiveSubmissions() throws FetchException
    {
        return fetchAllPages(ACTIVE_PATH, ActiveJobSubmission.class);
    }
    
    /* ---------------------------------------------------------------------- */
    /* retrieveFile:                                                          */
    /* ---------------------------------------------------------------------- */
    @Override
    public String retrieveFile(JobScriptFile file) throws FetchException
    {
        // File names are user supplied, so each segment is encoded.
        HttpGet get;
        try {get = new HttpGet(resolveSegments(file.getPathSegments()));}
            catch (URISyntaxException | IllegalArgumentException e) {
                String msg = MsgUtils.getMsg("AGENT_API_FETCH_ERROR", "GET", file.getPath(), e.getMessage());
                throw new FetchException(msg, e);
            }
        
        try {return execute(get);}
            catch (IOException | HttpStatusException e) {
                String msg = MsgUtils.getMsg("AGENT_API_FETCH_ERROR", get.getMethod(), get.getURI(), e.getMessage());
                throw new FetchException(msg, e);
            }
    }
    
    /* ---------------------------------------------------------------------- */
    /* markSubmitted:                                                         */
    /* ---------------------------------------------------------------------- */
    @Override
    public void markSubmitted(long id, String slurmJobId, SchedulerJobInfo info) 
     throws ReportException
    {
        var body = new JsonObject();
        body.addProperty("id", id);
        body.add("slurm_job_id", toSlurmIdElement(slurmJobId));
        if (info != null) {
            body.addProperty("slurm_job_state", info.getRawState());
            body.addProperty("slurm_job_info", toJobInfoText(info.getFields()));
            body.addProperty("slurm_job_state_reason", info.getEffectiveReason());
        }
        send(new HttpPost(resolveForReport("POST", SUBMITTED_PATH)), body);
    }
    
    /* ---------------------------------------------------------------------- */
    /* markRejected:                                                          */
    /* ---------------------------------------------------------------------- */
    @Override
    public void markRejected(long id, String reason) throws ReportException
    {
        var body = new JsonObject();
        body.addProperty("id", id);
        body.addProperty("report_message", reason);
        send(new HttpPost(resolveForReport("POST", REJECTED_PATH)), body);
    }
    
    /* ---------------------------------------------------------------------- */
    /* updateStatus:                                                          */
    /* ---------------------------------------------------------------------- */
    @Override
    public void updateStatus(long id, JobStatusUpdate update) throws ReportException
    {
        var body = new JsonObject();
        body.addProperty("status", update.getStatus().name());
        if (update.getSlurmJobId() != null) 
            body.add("slurm_job_id", toSlurmIdElement(update.getSlurmJobId()));
        body.addProperty("slurm_job_state", update.getSlurmJobState());
        if (update.getSlurmJobInfo() != null)
            body.addProperty("slurm_job_info", toJobInfoText(update.getSlurmJobInfo()));
        body.addProperty("slurm_job_state_reason", update.getSlurmJobStateReason());
        send(new HttpPut(resolveForReport("PUT", UPDATE_PATH + id)), body);
    }
    
    /* ---------------------------------------------------------------------- */
    /* reportHealth:                                                          */
    /* ---------------------------------------------------------------------- */
    @Override
    public void reportHealth(long intervalSeconds) throws ReportException
    {
        URI uri;
        try {uri = new URIBuilder(resolve(HEALTH_PATH)).addParameter("interval", 
                                  Long.toString(intervalSeconds)).build();}
            catch (Exception e) {
                String msg = MsgUtils.getMsg("AGENT_API_REPORT_ERROR", "PUT", HEALTH_PATH, e.getMessage());
                throw new ReportException(msg, e);
            }
        send(new HttpPut(uri), null);
    }
    
    /* ---------------------------------------------------------------------- */
    /* close:                                                                 */
    /* ---------------------------------------------------------------------- */
    @Override
    public void close() throws IOException {_httpClient.close();}
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* fetchAllPages:                                                         */
    /* ---------------------------------------------------------------------- */
    /** Read pages until the last page or the per-cycle page limit. */
    private <T> List<T> fetchAllPages(String path, Class<T> itemClass) throws FetchException
    {
        Type envelopeType = TypeToken.getParameterized(ListResponseEnvelope.class, itemClass).getType();
        var items = new ArrayList<T>();
        for (int page = 1; page <= _maxPages; page++) {
            HttpGet get;
            try {
                get = new HttpGet(new URIBuilder(resolve(path))
                                    .addParameter("page", Integer.toString(page))
                                    .addParameter("size", Integer.toString(_pageSize))
                                    .build());
            } catch (Exception e) {
                String msg = MsgUtils.getMsg("AGENT_API_FETCH_ERROR", "GET", path, e.getMessage());
                throw new FetchException(msg, e);
            }
            
            ListResponseEnvelope<T> envelope;
            try {
                String json = execute(get);
                envelope = AgentGsonUtils.getGson().fromJson(json, envelopeType);
            } catch (IOException | HttpStatusException | JsonParseException e) {
                String msg = MsgUtils.getMsg("AGENT_API_FETCH_ERROR", get.getMethod(), get.getURI(), e.getMessage());
                throw new FetchException(msg, e);
            }
            
            // An empty body parses to null.
            if (envelope == null || envelope.getItems() == null || envelope.getItems().isEmpty()) break;
            items.addAll(envelope.getItems());
            if (envelope.getPage() >= envelope.getPages()) break;
            
            if (page == _maxPages)
                _log.warn(MsgUtils.getMsg("AGENT_API_PAGE_LIMIT", path, _maxPages, envelope.getPages()));
        }
        return items;
    }
    
    /* ---------------------------------------------------------------------- */
    /* send:                                                                  */
    /* ---------------------------------------------------------------------- */
    private void send(HttpEntityEnclosingRequestBase request, JsonObject body) throws ReportException
    {
        if (body != null) 
            request.setEntity(new StringEntity(AgentGsonUtils.getGson().toJson(body), ContentType.APPLICATION_JSON));
        try {execute(request);}
            catch (IOException | HttpStatusException e) {
                String msg = MsgUtils.getMsg("AGENT_API_REPORT_ERROR", request.getMethod(), request.getURI(), 
                                             e.getMessage());
                throw new ReportException(msg, e);
            }
    }
    
    /* ---------------------------------------------------------------------- */
    /* execute:                                                               */
    /* ---------------------------------------------------------------------- */
    /** Issue a request and return its body.  Non-2xx statuses are errors. */
    private String execute(HttpRequestBase request) throws IOException, HttpStatusException
    {
        if (StringUtils.isNotBlank(_accessToken))
            request.setHeader(HttpHeaders.AUTHORIZATION, BEARER_PREFIX + _accessToken);
        request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
        if (_log.isDebugEnabled()) _log.debug(MsgUtils.getMsg("AGENT_API_REQUEST", request.getMethod(), request.getURI()));
        
        try (CloseableHttpResponse response = _httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            String body = response.getEntity() == null ? "" : 
                            EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            if (_log.isDebugEnabled()) 
                _log.debug(MsgUtils.getMsg("AGENT_API_RESPONSE", request.getMethod(), request.getURI(), status));
            if (status < 200 || status >= 300) 
                throw new HttpStatusException(status, StringUtils.abbreviate(body.strip(), MAX_BODY_EXCERPT));
            return body;
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* resolve:                                                               */
    /* ---------------------------------------------------------------------- */
    private URI resolve(String path) {return _baseUrl.resolve(path);}
    
    /* ---------------------------------------------------------------------- */
    /* resolveForReport:                                                      */
    /* ---------------------------------------------------------------------- */
    private URI resolveForReport(String method, String path) throws ReportException
    {
        try {return resolve(path);}
            catch (IllegalArgumentException e) {
                String msg = MsgUtils.getMsg("AGENT_API_REPORT_ERROR", method, path, e.getMessage());
                throw new ReportException(msg, e);
            }
    }
    
    /* ---------------------------------------------------------------------- */
    /* resolveSegments:                                                       */
    /* ---------------------------------------------------------------------- */
    /** Append raw path segments to the base url, encoding each one. */
    private URI resolveSegments(List<String> segments) throws URISyntaxException
    {
        var builder = new URIBuilder(_baseUrl);
        var path = new ArrayList<String>();
        for (String segment : builder.getPathSegments()) 
            if (!segment.isEmpty()) path.add(segment);
        path.addAll(segments);
        return builder.setPathSegments(path).build();
    }
    
    /* ---------------------------------------------------------------------- */
    /* toSlurmIdElement:                                                      */
    /* ---------------------------------------------------------------------- */
    /** The API stores slurm ids as integers; ids of other shapes go as text. */
    private static JsonPrimitive toSlurmIdElement(String slurmJobId)
    {
        if (StringUtils.isNumeric(slurmJobId)) return new JsonPrimitive(new BigInteger(slurmJobId));
        return new JsonPrimitive(slurmJobId);
    }
    
    /* ---------------------------------------------------------------------- */
    /* toJobInfoText:                                                         */
    /* ---------------------------------------------------------------------- */
    private static String toJobInfoText(Map<String,String> fields)
    {
        return AgentGsonUtils.getGson().toJson(fields);
    }
    
    /* ********************************************************************** */
    /*                         HttpStatusException Class                      */
    /* ********************************************************************** */
    /** A response with a non-success status, converted by callers into the
     * fetch or report exception their contract declares.
     */
    private static final class HttpStatusException extends Exception
    {
        private static final long serialVersionUID = 4230926145087216522L;
        
        private HttpStatusException(int status, String body)
        {
            super(MsgUtils.getMsg("AGENT_API_BAD_STATUS", status, body));
        }
    }
}
