package com.questrail.hostbridge.command;

/**
 * How much damage a lost or duplicated command can do to host state.
 */
public enum Criticality
{
    /**
     * Destructive, structural, or result-bearing. Must travel over a channel that
     * reports success or failure synchronously.
     */
    CRITICAL,

    /**
     * Overwritable: a later command of the same shape fully repairs the effect
     * of a lost one.
     */
    REVERSIBLE
}
