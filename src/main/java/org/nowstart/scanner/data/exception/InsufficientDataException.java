package org.nowstart.scanner.data.exception;

public class InsufficientDataException extends IndicatorException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
