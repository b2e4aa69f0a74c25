package com.star.eximscanner.event;

@FunctionalInterface
public interface EventSink {
    void produceEvent(NormalizedEvent event);
}
