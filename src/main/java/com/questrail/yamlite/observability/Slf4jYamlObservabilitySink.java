package com.questrail.yamlite.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of YamlObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jYamlObservabilitySink implements YamlObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jYamlObservabilitySink.class);

    @Override
    public void onLineSkipped(YamlSkippedLineEvent event) {
        log.debug("Ignoring line {} ({}): {}", event.lineNumber(), event.reason(), event.line());
    }

    @Override
    public void onDocumentEvent(YamlDocumentEvent event) {
        log.debug("YAML document {} {} ({} chars)", event.kind(), event.path(), event.characters());
    }

    @Override
    public void onError(YamlErrorEvent event) {
        var error = event.error();
        log.warn("YAML {} error on {}: {}", error.kind(), event.path(), error.message(), error.cause());
    }
}
