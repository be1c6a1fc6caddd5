package com.smartroute.core.classifier;

import com.smartroute.core.model.RoutingException;

/**
 * Internal fault while classifying content. The classifier converts it into a
 * HIGH sensitivity report.
 */
public class ClassificationException extends RoutingException {

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
