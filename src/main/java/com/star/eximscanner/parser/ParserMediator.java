package com.star.eximscanner.parser;

import com.star.eximscanner.event.NormalizedEvent;

import java.time.ZoneId;

/**
 * What a parser and its plugins may ask of the framework that drives them.
 */
public interface ParserMediator {

    /**
     * Zone applied to timestamps that carry no offset of their own.
     */
    ZoneId getTimezone();

    void produceEvent(NormalizedEvent event);

    /**
     * Polled between line units; once true no further unit is parsed.
     */
    boolean isAbortRequested();
}
