package io.omnivector.jobbergate.agent.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Message catalog access.  All operator-facing text is keyed in the 
 * AgentMessages.properties bundle and formatted with java.text.MessageFormat,
 * so placeholders take the {0}, {1}, ... form.
 * 
 * Lookup never throws.  A missing bundle or key produces a fallback string 
 * that names the key and echoes the parameters so that no diagnostic
 * information is lost.
 */
public final class MsgUtils 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(MsgUtils.class);
    
    // The bundle base name.
    public static final String BUNDLE_NAME = "io.omnivector.jobbergate.agent.i18n.AgentMessages";
    
    /* ********************************************************************** */
    /*                                Fields                                  */
    /* ********************************************************************** */
    // Loaded once, null if the bundle could not be found.
    private static final ResourceBundle _bundle = loadBundle();
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private MsgUtils() {}
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* getMsg:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Retrieve the message text for the key and fill in its parameters.
     * 
     * @param key the message key
     * @param parms zero or more values that replace the message placeholders
     * @return the formatted message, never null
     */
    public static String getMsg(String key, Object... parms)
    {
        // Get the raw text.
        String text = null;
        if (_bundle != null) 
            try {text = _bundle.getString(key);}
                catch (MissingResourceException e) {
                    _log.warn("Message key not found in " + BUNDLE_NAME + ": " + key);
                }
        
        // Construct a fallback message that preserves the parameters.
        if (text == null) return makeFallbackMsg(key, parms);
        
        // No parameters means no formatting.
        if (parms == null || parms.length == 0) return text;
        return MessageFormat.format(text, parms);
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* loadBundle:                                                            */
    /* ---------------------------------------------------------------------- */
    private static ResourceBundle loadBundle()
    {
        try {return ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);}
            catch (MissingResourceException e) {
                _log.error("Unable to load message bundle " + BUNDLE_NAME, e);
                return null;
            }
    }
    
    /* ---------------------------------------------------------------------- */
    /* makeFallbackMsg:                                                       */
    /* ---------------------------------------------------------------------- */
    private static String makeFallbackMsg(String key, Object... parms)
    {
        var buf = new StringBuilder(128);
        buf.append("MESSAGE NOT FOUND: ").append(key);
        if (parms != null)
            for (int i = 0; i < parms.length; i++) 
                buf.append(i == 0 ? " (" : ", ").append(parms[i]).append(i == parms.length - 1 ? ")" : "");
        return buf.toString();
    }
}
