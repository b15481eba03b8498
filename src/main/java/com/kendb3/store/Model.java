package com.kendb3.store;

import lombok.Getter;
import lombok.Setter;

/**
 * Base class of every stored model. The storage layer owns instances; API code
 * only borrows them for the duration of a serialize or deserialize call.
 */
@Getter
@Setter
public abstract class Model {

    /**
     * Primary identifier, {@code null} until the instance is saved or assigned.
     */
    private Long pk;

    @Override
    public String toString() {
        return getClass().getSimpleName() + " object (" + pk + ")";
    }
}
