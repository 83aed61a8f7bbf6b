package org.nowstart.scanner.service.backtest.model;

/**
 * Per-symbol simulator state. A symbol is either flat or holds exactly one position.
 */
public sealed interface PositionState permits PositionState.Flat, PositionState.InPosition {

    PositionState FLAT = new Flat();

    static PositionState flat() {
        return FLAT;
    }

    static PositionState holding(Position position) {
        return new InPosition(position);
    }

    default boolean isFlat() {
        return this instanceof Flat;
    }

    record Flat() implements PositionState {
    }

    record InPosition(Position position) implements PositionState {

        public InPosition {
            if (position == null) {
                throw new IllegalArgumentException("position is required");
            }
        }
    }
}
