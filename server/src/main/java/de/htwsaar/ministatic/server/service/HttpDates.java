package de.htwsaar.ministatic.server.service;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.http.HttpHeaders;

/**
 * Hilfsfunktionen für HTTP-Datumswerte.
 *
 * <p>Ein nicht lesbares Datum ist ein eigener Fall ({@link Optional#empty()}), kein Vergleichswert.</p>
 */
final class HttpDates {

    /** asctime füllt einstellige Tage mit Leerzeichen auf ("Nov  6"); der Parser erwartet "Nov 06". */
    private static final Pattern ASCTIME_PADDED_DAY = Pattern.compile("^(\\w{3} \\w{3})  (\\d) ");

    private HttpDates() {
        // Utility
    }

    /**
     * Liest ein HTTP-Datum (IMF-fixdate, RFC 850 oder asctime).
     *
     * @param value Header-Wert, darf {@code null} sein
     * @return Zeitpunkt oder leer, wenn fehlend oder nicht lesbar
     */
    static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();

        HttpHeaders dateHeader = new HttpHeaders();
        dateHeader.set(HttpHeaders.DATE, ASCTIME_PADDED_DAY.matcher(value.trim()).replaceFirst("$1 0$2 "));
        try {
            ZonedDateTime parsed = dateHeader.getFirstZonedDateTime(HttpHeaders.DATE);
            return Optional.ofNullable(parsed).map(ZonedDateTime::toInstant);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** HTTP-Daten haben Sekundengenauigkeit; Vergleiche laufen auf dieser Auflösung. */
    static Instant toHttpPrecision(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS);
    }
}
