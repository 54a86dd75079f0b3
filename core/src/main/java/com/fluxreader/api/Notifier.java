package com.fluxreader.api;

/**
 * User-facing notices. The host decides how (toast, dialog, console).
 */
public interface Notifier {

    void info(String message);

    void error(String message);
}
