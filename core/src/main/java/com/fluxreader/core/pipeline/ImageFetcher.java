package com.fluxreader.core.pipeline;

import java.nio.file.Path;

/**
 * Fetches one image into an entry directory and records the outcome on the descriptor.
 * Implementations never leave a partial or rejected file behind.
 */
public interface ImageFetcher {

    /**
     * @param entryUrl canonical URL of the entry, used as Referer where a host requires one
     * @return true if the file was written and passed the sanity checks
     */
    boolean fetch(ImageDescriptor image, Path entryDir, String entryUrl);
}
