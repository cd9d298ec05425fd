package io.omnivector.jobbergate.agent.usermapper;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omnivector.jobbergate.agent.i18n.MsgUtils;

/** Submit every job as the same local user regardless of owner. */
public final class SingleUserMapper 
 implements UserMapper
{
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(SingleUserMapper.class);
    
    private final String _username;
    
    public SingleUserMapper(String username)
    {
        if (StringUtils.isBlank(username))
            throw new IllegalArgumentException(MsgUtils.getMsg("AGENT_NULL_PARAMETER", "SingleUserMapper", "username"));
        _username = username;
        _log.info(MsgUtils.getMsg("AGENT_SINGLE_USER_MAPPER", username));
    }
    
    @Override
    public String getUsername(String ownerEmail) {return _username;}
}
