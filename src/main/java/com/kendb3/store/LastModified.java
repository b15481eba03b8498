package com.kendb3.store;

import java.time.Instant;

/**
 * Capability of models that carry a last modification timestamp column.
 */
public interface LastModified {

    Instant getLastModified();
}
