package org.nowstart.scanner.data.exception;

public class IndicatorCalculationException extends IndicatorException {

    public IndicatorCalculationException(String message) {
        super(message);
    }
}
