package com.dice.ast;

/**
 * Which end of the sorted dice a keep or discard selector works from.
 */
public enum SelectMode {
    /**
     * Largest values first.
     */
    HIGH,

    /**
     * Smallest values first.
     */
    LOW
}
