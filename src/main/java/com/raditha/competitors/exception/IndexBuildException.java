package com.raditha.competitors.exception;

/**
 * The nearest-neighbour index could not be built or queried.
 */
public class IndexBuildException extends PipelineException {

    public IndexBuildException(String message) {
        super("similarity-graph", message);
    }

    public IndexBuildException(String message, Throwable cause) {
        super("similarity-graph", message, cause);
    }
}
