package com.questrail.yamlite.observability;

/**
 * No-op implementation of YamlObservabilitySink.
 */
public final class NullObservabilitySink implements YamlObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLineSkipped(YamlSkippedLineEvent event) {}

    @Override
    public void onDocumentEvent(YamlDocumentEvent event) {}

    @Override
    public void onError(YamlErrorEvent event) {}
}
