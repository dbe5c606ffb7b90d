package com.questrail.las.observability;

/**
 * No-op implementation of LasObservabilitySink.
 */
public final class NullObservabilitySink implements LasObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLoad(LasLoadEvent event) {}

    @Override
    public void onParseSkip(LasParseSkipEvent event) {}

    @Override
    public void onMutation(LasMutationEvent event) {}

    @Override
    public void onError(LasErrorEvent event) {}
}
