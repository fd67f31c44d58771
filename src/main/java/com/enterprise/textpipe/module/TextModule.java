package com.enterprise.textpipe.module;

/**
 * A named text-processing capability. Its name is the namespace of the tasks it processes.
 * Implementations should be thread-safe; workers may call them concurrently.
 */
public interface TextModule {

    /**
     * Module name, used as queue namespace
     */
    String getName();

    /**
     * Process a document and return the result text
     */
    String process(String text) throws Exception;

    /**
     * Convert a stored result to another format
     * @param id id of the task the result belongs to
     * @throws IllegalArgumentException if the format is not supported
     */
    default String convert(String id, String result, String format) {
        throw new IllegalArgumentException("Module " + getName() + " does not support format: " + format);
    }
}
