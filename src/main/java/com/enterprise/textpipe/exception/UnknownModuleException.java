package com.enterprise.textpipe.exception;

/**
 * Exception thrown when no processing module is registered under a name
 */
public class UnknownModuleException extends TextPipeException {

    private final String module;

    public UnknownModuleException(String module) {
        super("Unknown module: " + module);
        this.module = module;
    }

    public String getModule() {
        return module;
    }
}
