package com.fluxreader.core.workflow;

/**
 * Asks the user what to do after they interrupted a download.
 */
@FunctionalInterface
public interface CancellationPrompt {

    CancellationChoice ask(CancellationRequest request);

    /**
     * Treats every interruption as "keep going".
     */
    CancellationPrompt ALWAYS_CONTINUE = request ->
            request.offers(CancellationChoice.RESUME) ? CancellationChoice.RESUME : CancellationChoice.CONTINUE;
}
