package com.enterprise.textpipe.module;

/**
 * Returns the document unchanged. Useful for wiring checks.
 */
public class EchoModule implements TextModule {

    public static final String NAME = "echo";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String process(String text) {
        return text;
    }
}
