package io.omnivector.jobbergate.agent.testutils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** A clock that only moves when told to. */
public final class MutableClock 
 extends Clock
{
    private Instant _now;
    
    public MutableClock(Instant start) {_now = start;}
    
    public void advance(Duration d) {_now = _now.plus(d);}
    
    @Override
    public Instant instant() {return _now;}
    
    @Override
    public ZoneId getZone() {return ZoneOffset.UTC;}
    
    @Override
    public Clock withZone(ZoneId zone) {return this;}
}
