package com.raditha.competitors.exception;

/**
 * Community detection failed to return a valid partition.
 */
public class CommunityDetectionException extends PipelineException {

    public CommunityDetectionException(String message) {
        super("community-detection", message);
    }

    public CommunityDetectionException(String message, Throwable cause) {
        super("community-detection", message, cause);
    }
}
