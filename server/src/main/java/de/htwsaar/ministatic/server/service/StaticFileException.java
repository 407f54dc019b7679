package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.server.config.DefaultHeaders;
import org.springframework.http.HttpHeaders;

/**
 * Fachliche Exception aller Pipeline-Stufen.
 * Wird genau einmal in {@link StaticFilePipeline} gefangen und über den {@link ErrorReporter} beantwortet.
 */
public class StaticFileException extends RuntimeException {

    /**
     * Fehlerart mit zugehörigem HTTP-Statuscode.
     */
    public enum Failure {
        INVALID_PATH(400),
        PERMISSION_DENIED(403),
        NOT_FOUND(404),
        METHOD_NOT_ALLOWED(405),
        RANGE_NOT_SATISFIABLE(416),
        INTERNAL(500),
        VERSION_UNSUPPORTED(505);

        private final int statusCode;

        Failure(int statusCode) {
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }

    private final Failure failure;
    private final HttpHeaders extraHeaders;

    /**
     * Erstellt eine neue Exception ohne zusätzliche Header.
     *
     * @param failure Fehlerart
     * @param message Text für das Feld {@code message} des Fehlerbodys
     */
    public StaticFileException(Failure failure, String message) {
        this(failure, message, new HttpHeaders(), null);
    }

    private StaticFileException(Failure failure, String message, HttpHeaders extraHeaders, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.extraHeaders = HttpHeaders.readOnlyHttpHeaders(extraHeaders);
    }

    public static StaticFileException versionUnsupported() {
        return new StaticFileException(Failure.VERSION_UNSUPPORTED, "Only HTTP/1.1 is supported");
    }

    public static StaticFileException methodNotAllowed() {
        HttpHeaders allow = new HttpHeaders();
        allow.set(HttpHeaders.ALLOW, DefaultHeaders.ALLOWED_METHODS);
        return new StaticFileException(
                Failure.METHOD_NOT_ALLOWED, "Only GET and HEAD methods are allowed", allow, null);
    }

    public static StaticFileException invalidPath(String path) {
        return new StaticFileException(Failure.INVALID_PATH, "Invalid pathname: " + path);
    }

    public static StaticFileException notFound(String path) {
        return new StaticFileException(Failure.NOT_FOUND, "Not found: " + path);
    }

    public static StaticFileException permissionDenied(String path) {
        return new StaticFileException(Failure.PERMISSION_DENIED, "Permission denied: " + path);
    }

    /**
     * 416 inkl. {@code Content-Range: bytes *}{@code /<size>}, damit der Client die echte Größe erfährt.
     */
    public static StaticFileException rangeNotSatisfiable(String rangeHeader, long size) {
        HttpHeaders range = new HttpHeaders();
        range.set(HttpHeaders.CONTENT_RANGE, "bytes */" + size);
        return new StaticFileException(
                Failure.RANGE_NOT_SATISFIABLE, "Invalid range " + rangeHeader, range, null);
    }

    public static StaticFileException internal(String message, Throwable cause) {
        return new StaticFileException(Failure.INTERNAL, message, new HttpHeaders(), cause);
    }

    public Failure getFailure() {
        return failure;
    }

    public int getStatusCode() {
        return failure.statusCode();
    }

    /**
     * Header, die die Fehlerantwort zusätzlich tragen muss (z. B. {@code Allow} bei 405).
     *
     * @return schreibgeschützte Header, nie {@code null}
     */
    public HttpHeaders getExtraHeaders() {
        return extraHeaders;
    }
}
