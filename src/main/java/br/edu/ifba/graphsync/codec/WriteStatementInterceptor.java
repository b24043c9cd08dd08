package br.edu.ifba.graphsync.codec;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Hook invoked on the relational write path right before a statement is prepared.
 *
 * <p>Implementations may return a different SQL text for the same parameter list. The
 * parameters are never reordered, so the returned statement must keep the placeholder
 * order of the original.</p>
 */
@FunctionalInterface
public interface WriteStatementInterceptor {

    /**
     * Interceptor that leaves every statement untouched.
     */
    WriteStatementInterceptor NONE = (sql, parameters) -> sql;

    /**
     * Returns the statement to execute for the given SQL and bound parameters.
     *
     * @param sql the statement as written by the caller
     * @param parameters the parameters in placeholder order
     * @return the statement to prepare
     */
    @NotNull
    String beforeExecute(@NotNull String sql, @NotNull List<?> parameters);
}
