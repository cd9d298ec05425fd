package io.omnivector.jobbergate.agent.usermapper;

import io.omnivector.jobbergate.agent.exceptions.AgentException;

public class UserMappingException 
 extends AgentException
{
    private static final long serialVersionUID = 6618023594437190182L;

    public UserMappingException(String msg) {super(msg);}
}
