/**
 * Default LAS reader and writer.
 *
 * <p>Everything here is package-private except the two {@code Default*}
 * entry points. Each grammar lives in its own class:</p>
 * <ul>
 *   <li>{@code LasLines} - line endings, byte-order mark, comments</li>
 *   <li>{@code LasSectionSplitter} - {@code ~} headers</li>
 *   <li>{@code KeyValueSectionParser} - {@code ~V}, {@code ~W}, {@code ~P}</li>
 *   <li>{@code CurveInfoParser} - {@code ~C}</li>
 *   <li>{@code DelimiterNullResolver} - {@code DLM} / {@code NULL} and sniffing</li>
 *   <li>{@code AsciiDataParser} - {@code ~A}</li>
 * </ul>
 *
 * <p>None of these throw on malformed input.</p>
 */
package com.questrail.las.codec.impl;
