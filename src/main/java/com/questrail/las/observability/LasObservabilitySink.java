package com.questrail.las.observability;

/**
 * Receives events from the reader and the mutation engine.
 * Implementations can provide logging, metrics, or UI notifications.
 */
public interface LasObservabilitySink {
    /**
     * Called once per successful load.
     * @param event load summary
     */
    void onLoad(LasLoadEvent event);

    /**
     * Called for every line the reader ignored.
     * @param event the skipped line
     */
    void onParseSkip(LasParseSkipEvent event);

    /**
     * Called after a mutation, including its synchronizer pass, has been applied.
     * @param event the mutation
     */
    void onMutation(LasMutationEvent event);

    /**
     * Called when an operation is rejected before touching the document.
     * @param event the error
     */
    void onError(LasErrorEvent event);
}
