package de.htwsaar.ministatic.server.domain;

import java.io.IOException;

/**
 * Ergebnis eines Streaming-Vorgangs: vollständig geschrieben oder mit I/O-Fehler abgebrochen.
 *
 * @param bytesWritten geschriebene Nutzdaten-Bytes (ohne Multipart-Rahmen)
 * @param failure      Ursache des Abbruchs, {@code null} bei Erfolg
 */
public record StreamOutcome(long bytesWritten, IOException failure) {

    public static StreamOutcome completed(long bytesWritten) {
        return new StreamOutcome(bytesWritten, null);
    }

    public static StreamOutcome failed(long bytesWritten, IOException failure) {
        return new StreamOutcome(bytesWritten, failure);
    }

    public boolean isCompleted() {
        return failure == null;
    }
}
