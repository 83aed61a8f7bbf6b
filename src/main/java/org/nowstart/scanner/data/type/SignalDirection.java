package org.nowstart.scanner.data.type;

public enum SignalDirection {
    LONG,
    SHORT;

    public SignalDirection opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
