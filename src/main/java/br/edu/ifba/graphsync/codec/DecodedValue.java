package br.edu.ifba.graphsync.codec;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of decoding a value read from a semi-structured column.
 *
 * @param value the logical value, or the raw text when the stored text was malformed
 * @param malformed true when the stored text could not be parsed and {@code value} is the raw text
 */
public record DecodedValue(@Nullable Object value, boolean malformed) {

    static DecodedValue parsed(@Nullable Object value) {
        return new DecodedValue(value, false);
    }

    static DecodedValue raw(@Nullable Object value) {
        return new DecodedValue(value, true);
    }
}
