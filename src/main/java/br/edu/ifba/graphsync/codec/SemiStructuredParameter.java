package br.edu.ifba.graphsync.codec;

import org.jetbrains.annotations.Nullable;

/**
 * Marks a statement parameter that is bound to a semi-structured column.
 *
 * <p>{@link WriteStatementInterceptor} implementations use this marker to decide whether a
 * write statement has to be reshaped, and the JDBC binder encodes the wrapped value with
 * {@link SemiStructuredCodec} instead of binding it directly.</p>
 *
 * @param value the logical value (map, list, scalar, {@link Flattenable} or null)
 */
public record SemiStructuredParameter(@Nullable Object value) {

    public static SemiStructuredParameter of(@Nullable Object value) {
        return new SemiStructuredParameter(value);
    }
}
