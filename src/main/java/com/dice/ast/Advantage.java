package com.dice.ast;

/**
 * Resolves the roll a second time and keeps the side with the higher total.
 */
public record Advantage() implements Selector {

    public static final Advantage INSTANCE = new Advantage();
}
