package com.fluxreader.api;

import com.fluxreader.services.navigation.NavigationContext;

import java.nio.file.Path;

/**
 * External renderer for a finished local document.
 * The renderer calls back into the core through the status service and the navigator.
 */
public interface EntryViewer {

    void open(long entryId, Path htmlFile, NavigationContext context);
}
