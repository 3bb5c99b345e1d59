package com.raditha.smells.model;

/**
 * Where an attribute access is rooted.
 */
public enum AccessOrigin {
    /** The method's own receiver */
    SELF,
    /** Some other named object, including one reached through a receiver field */
    FOREIGN
}
