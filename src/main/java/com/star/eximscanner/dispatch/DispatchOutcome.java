package com.star.eximscanner.dispatch;

/**
 * Which path produced the event for a dispatched record.
 */
public enum DispatchOutcome {
    /** No enabled plugin for the reporter; the generic event was produced. */
    GENERIC,
    /** The reporter's plugin produced its own event. */
    PLUGIN,
    /** The reporter's plugin declined; the generic event was produced instead. */
    PLUGIN_DECLINED
}
