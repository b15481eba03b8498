package com.kendb3.api.codegen;

/**
 * A generator of build resources, run once after every model is registered.
 */
@FunctionalInterface
public interface Autogenerator {

    void generate();
}
