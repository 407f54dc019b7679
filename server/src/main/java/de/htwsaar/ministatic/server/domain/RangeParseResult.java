package de.htwsaar.ministatic.server.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ergebnis des {@link RangeParser}.
 *
 * @param status Klassifikation des Headers
 * @param ranges erfüllbare Bereiche in Anfragereihenfolge; leer außer bei {@link Status#SATISFIABLE}
 */
public record RangeParseResult(Status status, List<ByteRange> ranges) {

    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        MALFORMED
    }

    public RangeParseResult {
        Objects.requireNonNull(status, "status must not be null");
        ranges = List.copyOf(ranges);
        if ((status == Status.SATISFIABLE) == ranges.isEmpty()) {
            throw new IllegalArgumentException("ranges must be present exactly when satisfiable");
        }
    }

    public static RangeParseResult of(List<ByteRange> ranges) {
        return new RangeParseResult(Status.SATISFIABLE, ranges);
    }

    public static RangeParseResult unsatisfiable() {
        return new RangeParseResult(Status.UNSATISFIABLE, List.of());
    }

    public static RangeParseResult malformed() {
        return new RangeParseResult(Status.MALFORMED, List.of());
    }

    public boolean satisfiable() {
        return status == Status.SATISFIABLE;
    }
}
