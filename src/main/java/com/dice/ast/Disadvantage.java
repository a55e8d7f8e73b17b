package com.dice.ast;

/**
 * Resolves the roll a second time and keeps the side with the lower total.
 */
public record Disadvantage() implements Selector {

    public static final Disadvantage INSTANCE = new Disadvantage();
}
