package de.htwsaar.ministatic.server.service;

/**
 * Signalisiert einen Streaming-Fehler nach bereits gesendeten Headern.
 *
 * <p>Es kann keine Fehlerantwort mehr folgen; die Exception läuft bis zum Servlet-Container,
 * der die Verbindung daraufhin ohne weitere Ausgabe schließt.</p>
 */
public class ResponseAbortedException extends RuntimeException {

    private final long bytesWritten;

    public ResponseAbortedException(String message, long bytesWritten, Throwable cause) {
        super(message, cause);
        this.bytesWritten = bytesWritten;
    }

    public long getBytesWritten() {
        return bytesWritten;
    }
}
