package io.omnivector.jobbergate.agent.utils;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/** Gson configured for the Jobbergate API, which uses snake_case field 
 * names throughout.  Gson instances are thread-safe, so one is shared.
 */
public final class AgentGsonUtils 
{
    private static final Gson _gson = newGsonBuilder().create();
    private static final Gson _prettyGson = newGsonBuilder().setPrettyPrinting().create();
    
    private AgentGsonUtils() {}
    
    /** The shared instance. */
    public static Gson getGson() {return _gson;}
    
    /** The shared instance, indenting its output.  Only used for tracing. */
    public static Gson getGson(boolean prettyPrint) {return prettyPrint ? _prettyGson : _gson;}
    
    private static GsonBuilder newGsonBuilder()
    {
        return new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .disableHtmlEscaping();
    }
}
