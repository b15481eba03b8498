package com.kendb3.submissions.model;

/**
 * Thrown when versions of different families are compared.
 */
public class IncomparableVersionsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IncomparableVersionsException(MinecraftVersion left, MinecraftVersion right) {
        super("Attempted to compare versions of different families: " + left + " and " + right);
    }
}
