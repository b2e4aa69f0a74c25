package com.star.eximscanner.plugin;

public enum PluginOutcome {
    /** The plugin produced exactly one event through the mediator. */
    EMITTED,
    /** The record is not in a format the plugin understands; nothing was produced. */
    DECLINED
}
