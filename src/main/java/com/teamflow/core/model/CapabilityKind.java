package com.teamflow.core.model;

/**
 * Dimension a capability tag belongs to.
 */
public enum CapabilityKind {
    GENERAL,
    LANGUAGE,
    FRAMEWORK,
    DOMAIN
}
