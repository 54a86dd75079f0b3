package com.fluxreader.test;

import com.fluxreader.core.pipeline.ImageDescriptor;
import com.fluxreader.core.pipeline.ImageFetcher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a small fake image for every URL not listed in {@link #failing}.
 */
public class FakeImageFetcher implements ImageFetcher {
    public final List<String> fetched = new ArrayList<>();
    public final Set<String> failing = new HashSet<>();

    @Override
    public boolean fetch(ImageDescriptor image, Path entryDir, String entryUrl) {
        String url = image.getDownloadUrl();
        fetched.add(url);
        if (failing.contains(url)) {
            image.markFailed("HTTP 404");
            return false;
        }
        try {
            Files.write(entryDir.resolve(image.getFilename()), new byte[]{(byte) 0x89, 'P', 'N', 'G', 1, 2, 3, 4, 5, 6, 7, 8});
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        image.markDownloaded();
        return true;
    }
}
