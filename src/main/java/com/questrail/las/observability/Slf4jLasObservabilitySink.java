package com.questrail.las.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LasObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLasObservabilitySink implements LasObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLasObservabilitySink.class);

    @Override
    public void onLoad(LasLoadEvent event) {
        log.info("LAS loaded: {} curves, {} rows, delimiter={}, null={}, sections={}",
            event.curveCount(),
            event.rowCount(),
            event.delimiter(),
            event.nullValue() != null ? event.nullValue() : "unresolved",
            event.sectionCount());

        if (event.skippedLines() > 0) {
            log.info("LAS load skipped {} malformed line(s)", event.skippedLines());
        }
    }

    @Override
    public void onParseSkip(LasParseSkipEvent event) {
        log.debug("Skipped ~{} line {} ({}): {}",
            event.section(), event.lineNumber(), event.reason(), event.line());
    }

    @Override
    public void onMutation(LasMutationEvent event) {
        log.info("Curve {} {}{}",
            event.mnemonic(),
            event.kind(),
            event.detail().isEmpty() ? "" : ": " + event.detail());
    }

    @Override
    public void onError(LasErrorEvent event) {
        log.warn("Curve operation rejected: {}", event.message(), event.cause());
    }
}
