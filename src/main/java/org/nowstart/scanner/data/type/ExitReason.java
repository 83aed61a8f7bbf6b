package org.nowstart.scanner.data.type;

public enum ExitReason {
    OPPOSITE_SIGNAL,
    STOP_LOSS,
    TAKE_PROFIT,
    TIMEOUT,
    END_OF_PERIOD
}
