package com.questrail.yamlite.observability;

/**
 * Main interface for receiving codec and document-file observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface YamlObservabilitySink {
    /**
     * Called when the decoder ignores a line it cannot attach to the tree.
     * @param event the skipped line details
     */
    void onLineSkipped(YamlSkippedLineEvent event);

    /**
     * Called when a document has been read from or written to a file.
     * @param event the document event
     */
    void onDocumentEvent(YamlDocumentEvent event);

    /**
     * Called when a file or mutator operation fails.
     * @param event the error event
     */
    void onError(YamlErrorEvent event);
}
