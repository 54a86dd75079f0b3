package com.fluxreader.core.workflow;

import java.util.ArrayList;
import java.util.List;

import static com.fluxreader.core.workflow.CancellationChoice.*;

/**
 * What the prompt is asked when the user interrupts a download.
 *
 * @param batch null outside batch runs
 */
public record CancellationRequest(DownloadPhase phase, String entryTitle, List<CancellationChoice> options,
                                  BatchState batch) {

    public static CancellationRequest forEntry(DownloadPhase phase, String title, BatchState batch) {
        return new CancellationRequest(phase, title, entryOptions(phase, batch), batch);
    }

    public static CancellationRequest betweenEntries(String title, BatchState batch) {
        List<CancellationChoice> options = new ArrayList<>();
        options.add(CANCEL_ALL_ENTRIES);
        options.add(batch.isSkipImagesForAll() ? INCLUDE_IMAGES_ALL : SKIP_IMAGES_ALL);
        options.add(CONTINUE);
        return new CancellationRequest(DownloadPhase.PREPARING, title, List.copyOf(options), batch);
    }

    static List<CancellationChoice> entryOptions(DownloadPhase phase, BatchState batch) {
        if (batch == null) {
            return phase == DownloadPhase.DOWNLOADING
                    ? List.of(CANCEL_ENTRY, CONTINUE_WITHOUT_IMAGES, RESUME)
                    : List.of(CANCEL_ENTRY, CONTINUE);
        }
        if (phase != DownloadPhase.DOWNLOADING) {
            return List.of(CANCEL_ENTRY, CANCEL_ALL_ENTRIES, CONTINUE);
        }
        List<CancellationChoice> options = new ArrayList<>(List.of(CANCEL_ENTRY, CANCEL_ALL_ENTRIES,
                SKIP_IMAGES_CURRENT, SKIP_IMAGES_ALL));
        if (batch.isSkipImagesForAll()) options.add(INCLUDE_IMAGES_ALL);
        options.add(RESUME);
        return List.copyOf(options);
    }

    public boolean offers(CancellationChoice choice) {
        return options.contains(choice);
    }
}
