package com.publicdomain.matching.core.model;

/**
 * Kind of historical copyright record a candidate came from.
 */
public enum SourceType {
    REGISTRATION,
    RENEWAL
}
