package de.htwsaar.ministatic.server.adapter;

import de.htwsaar.ministatic.server.domain.ByteRange;
import de.htwsaar.ministatic.server.domain.RangeParseResult;
import de.htwsaar.ministatic.server.domain.RangeParser;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpRange;

/**
 * {@link RangeParser} auf Basis von {@link HttpRange#parseRanges(String)}.
 *
 * <p>Bereiche, die hinter dem Dateiende beginnen, werden verworfen; Enden jenseits der
 * Datei werden auf das letzte Byte gekürzt. Bleibt kein Bereich übrig, ist der Header
 * unerfüllbar. Syntaxfehler, fremde Einheiten und mehr als 100 Bereiche gelten als
 * fehlerhaft.</p>
 */
public final class SpringRangeParser implements RangeParser {

    @Override
    public RangeParseResult parse(long totalSize, String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return RangeParseResult.malformed();
        }

        List<HttpRange> parsed;
        try {
            parsed = HttpRange.parseRanges(headerValue.trim());
        } catch (IllegalArgumentException e) {
            return RangeParseResult.malformed();
        }
        if (parsed.isEmpty()) {
            return RangeParseResult.malformed();
        }

        List<ByteRange> satisfiable = new ArrayList<>(parsed.size());
        for (HttpRange range : parsed) {
            long start = range.getRangeStart(totalSize);
            long end = range.getRangeEnd(totalSize);
            if (start >= totalSize || start > end) continue;
            satisfiable.add(new ByteRange(start, end));
        }
        return satisfiable.isEmpty() ? RangeParseResult.unsatisfiable() : RangeParseResult.of(satisfiable);
    }
}
