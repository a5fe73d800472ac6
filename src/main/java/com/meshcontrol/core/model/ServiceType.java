package com.meshcontrol.core.model;

/**
 * Coarse classification of a registered service, used for grouping in status views.
 */
public enum ServiceType {
    SECURITY,
    AI_AGENT,
    BOT,
    INTERFACE,
    DATABASE,
    CACHE,
    API,
    MONITORING
}
