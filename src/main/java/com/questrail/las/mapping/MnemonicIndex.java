package com.questrail.las.mapping;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * MnemonicIndex
 * -----------------------------------------------------------------------------
 * Case-insensitive lookup from curve mnemonic to 0-based column position.
 *
 * <h2>Lifecycle</h2>
 * The document keeps one of these alongside its curves and rebuilds it
 * whenever the curve list changes structurally (add, remove, rename).
 *
 * <h2>Duplicates</h2>
 * Real files occasionally define the same mnemonic twice. Both columns are
 * kept; the index resolves the name to the <b>first</b> position, so later
 * duplicates are reachable only by position.
 *
 * Instances are immutable.
 */
public final class MnemonicIndex
{
    private static final MnemonicIndex EMPTY = new MnemonicIndex(Collections.emptyMap(), 0);

    private final Map<String, Integer> firstIndexByKey;
    private final int size;

    private MnemonicIndex(Map<String, Integer> firstIndexByKey, int size) {
        this.firstIndexByKey = firstIndexByKey;
        this.size = size;
    }

    /**
     * Builds an index over mnemonics given in column order.
     *
     * @param mnemonicsInColumnOrder position in the list is the column index
     */
    public static MnemonicIndex of(List<String> mnemonicsInColumnOrder) {
        Objects.requireNonNull(mnemonicsInColumnOrder, "mnemonicsInColumnOrder");
        if (mnemonicsInColumnOrder.isEmpty()) {
            return EMPTY;
        }

        Map<String, Integer> tmp = new HashMap<>(mnemonicsInColumnOrder.size() * 2);
        for (int i = 0; i < mnemonicsInColumnOrder.size(); i++) {
            String name = Objects.requireNonNull(mnemonicsInColumnOrder.get(i), "mnemonic at index " + i);
            tmp.putIfAbsent(fold(name), i);
        }
        return new MnemonicIndex(Collections.unmodifiableMap(tmp), mnemonicsInColumnOrder.size());
    }

    /**
     * Returns the number of columns this index was built over (duplicates included).
     */
    public int size() {
        return size;
    }

    /**
     * Resolves a mnemonic to the first column carrying it, ignoring case.
     */
    public OptionalInt find(String mnemonic) {
        Objects.requireNonNull(mnemonic, "mnemonic");
        Integer idx = firstIndexByKey.get(fold(mnemonic));
        return idx == null ? OptionalInt.empty() : OptionalInt.of(idx);
    }

    /**
     * Returns true if some column carries {@code mnemonic}, ignoring case.
     */
    public boolean contains(String mnemonic) {
        return find(mnemonic).isPresent();
    }

    /**
     * Case folding used for every mnemonic comparison in the library.
     */
    public static String fold(String mnemonic) {
        return mnemonic.toUpperCase(Locale.ROOT);
    }

    /**
     * Compares two mnemonics the way lookups do.
     */
    public static boolean sameMnemonic(String a, String b) {
        return fold(a).equals(fold(b));
    }
}
