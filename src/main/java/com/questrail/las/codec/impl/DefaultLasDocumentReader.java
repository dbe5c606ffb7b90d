package com.questrail.las.codec.impl;

import com.questrail.las.codec.LasDocumentReader;
import com.questrail.las.internal.sync.CurveRowSynchronizer;
import com.questrail.las.model.Curve;
import com.questrail.las.model.LasDocument;
import com.questrail.las.model.LasSections;
import com.questrail.las.model.ParameterRecord;
import com.questrail.las.model.RawSection;
import com.questrail.las.model.WrapMode;
import com.questrail.las.observability.LasLoadEvent;
import com.questrail.las.observability.LasObservabilitySink;
import com.questrail.las.observability.LasParseSkipEvent;
import com.questrail.las.observability.NullObservabilitySink;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Default implementation of {@link LasDocumentReader}.
 *
 * <p>Pipeline: split into sections, parse the key-value sections, parse the
 * curve definitions, resolve the null value and delimiter, read the table,
 * replace sentinels, then distribute the table into curves.</p>
 *
 * <p>Malformed lines never abort a load. Each one is reported to the
 * observability sink and skipped.</p>
 */
public final class DefaultLasDocumentReader implements LasDocumentReader
{
    private final LasObservabilitySink sink;

    public DefaultLasDocumentReader() {
        this(NullObservabilitySink.INSTANCE);
    }

    public DefaultLasDocumentReader(LasObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public LasDocument read(String text) {
        Objects.requireNonNull(text, "text");

        final LasDocument document = new LasDocument();
        document.setLineEnding(LasLines.detectLineEnding(text));

        final int[] skipped = {0};
        final Consumer<LasParseSkipEvent> onSkip = event -> {
            skipped[0]++;
            sink.onParseSkip(event);
        };

        List<RawSection> sections = LasSectionSplitter.split(LasLines.split(text));
        for (RawSection section : sections) {
            document.addRawSection(section);
        }

        // ---------------------------------------------------------------------
        // Header sections
        // ---------------------------------------------------------------------

        document.section(LasSections.VERSION).ifPresent(section -> {
            for (ParameterRecord r : KeyValueSectionParser.parse(section, onSkip)) {
                document.putVersionParam(r);
            }
        });
        document.section(LasSections.WELL).ifPresent(section -> {
            for (ParameterRecord r : KeyValueSectionParser.parse(section, onSkip)) {
                document.putWellParam(r);
            }
        });
        document.section(LasSections.PARAMETER).ifPresent(section -> {
            for (ParameterRecord r : KeyValueSectionParser.parse(section, onSkip)) {
                document.putParameterParam(r);
            }
        });

        document.versionParam("VERS")
                .map(ParameterRecord::effectiveValue)
                .filter(v -> !v.isBlank())
                .ifPresent(document::setVersion);
        document.setWrapMode(WrapMode.fromDeclared(
                document.versionParam("WRAP").map(ParameterRecord::effectiveValue).orElse(null)));

        document.section(LasSections.CURVE).ifPresent(section -> {
            for (Curve c : CurveInfoParser.parse(section, onSkip)) {
                document.addCurve(c);
            }
        });

        // ---------------------------------------------------------------------
        // Table
        // ---------------------------------------------------------------------

        document.setNullValue(DelimiterNullResolver.resolveNullValue(document));
        document.setDelimiter(DelimiterNullResolver.resolveDelimiter(document));

        Optional<RawSection> ascii = document.section(LasSections.ASCII);
        if (ascii.isPresent()) {
            List<List<Double>> rows = AsciiDataParser.parse(
                    ascii.get(), document.delimiter(), document.wrapMode(), document.curveCount());
            AsciiDataParser.replaceSentinel(rows, document.nullValue().isPresent()
                    ? document.nullValue().getAsDouble() : null);
            document.replaceTable(AsciiDataParser.toDataRows(rows));
        }

        CurveRowSynchronizer.distribute(document);

        sink.onLoad(new LasLoadEvent(
                sections.size(),
                document.curveCount(),
                document.rowCount(),
                document.delimiter(),
                document.nullValue().isPresent() ? document.nullValue().getAsDouble() : null,
                skipped[0]));

        return document;
    }
}
