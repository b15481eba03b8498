package com.kendb3.api.exception;

/**
 * A field group that the model never declared was requested.
 */
public class UnknownFieldGroupException extends ApiException {

    private static final long serialVersionUID = 1L;

    private final String group;

    public UnknownFieldGroupException(String group) {
        super("No fields registered in group '" + group + "'");
        this.group = group;
    }

    public String getGroup() {
        return group;
    }
}
