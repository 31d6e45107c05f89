package com.apimock.service.api;

/**
 * The channel through which import and export problems reach the user.
 */
public interface Notifier {

    void warning(String message);

    void error(String message);
}
