package org.nowstart.scanner.data.exception;

/**
 * Base type for recoverable indicator failures. Callers skip the current bar or symbol.
 */
public abstract class IndicatorException extends RuntimeException {

    protected IndicatorException(String message) {
        super(message);
    }
}
