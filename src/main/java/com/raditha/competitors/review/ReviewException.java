package com.raditha.competitors.review;

/**
 * A review question could not be answered. Only affects the cluster being
 * reviewed.
 */
public class ReviewException extends RuntimeException {

    public ReviewException(String message) {
        super(message);
    }

    public ReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
