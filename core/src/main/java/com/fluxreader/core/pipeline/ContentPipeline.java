package com.fluxreader.core.pipeline;

import com.fluxreader.common.model.Entry;

import java.io.File;
import java.nio.file.Path;

/**
 * Turns a server entry into a self-contained offline document.
 * <p>
 * The steps are exposed separately so a caller can interleave checkpoints between
 * image fetches; {@link #process} runs them all in one go.
 */
public interface ContentPipeline {

    /**
     * Parses the body, replaces video players with thumbnails and discovers images.
     */
    PreparedContent prepare(Entry entry);

    /**
     * Fetches one image. Failure is recorded on the descriptor and never thrown.
     */
    boolean materialize(ImageDescriptor image, Path entryDir, String entryUrl);

    /**
     * Rewrites image references, strips unsupported elements and wraps the body in a document.
     */
    RenderedDocument render(PreparedContent prepared, File entryDir);

    default RenderedDocument process(Entry entry, File entryDir, boolean includeImages) {
        PreparedContent prepared = prepare(entry);
        if (includeImages) {
            for (ImageDescriptor image : prepared.getImages()) {
                materialize(image, entryDir.toPath(), entry.getUrl());
            }
        }
        return render(prepared, entryDir);
    }
}
