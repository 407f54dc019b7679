package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.common.serialization.JacksonCodec;
import de.htwsaar.ministatic.server.domain.BodyStrategy;
import de.htwsaar.ministatic.server.domain.ErrorPayload;
import de.htwsaar.ministatic.server.domain.ResponseIntent;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Einheitliche JSON-Fehlerantwort, unabhängig von der auslösenden Stufe.
 *
 * <p>Ist die Antwort bereits festgeschrieben, passiert nichts; das ist der einzige Schutz
 * gegen doppeltes Antworten. Die Methode wirft nie.</p>
 */
@Component
public class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    /** Header, die zu einer (Teil-)Erfolgsantwort gehören und nie in einer Fehlerantwort landen. */
    private static final List<String> SUCCESS_ONLY_HEADERS = List.of(
            HttpHeaders.ETAG,
            HttpHeaders.LAST_MODIFIED,
            HttpHeaders.VARY,
            HttpHeaders.CONTENT_ENCODING,
            HttpHeaders.CONTENT_TYPE,
            HttpHeaders.CONTENT_LENGTH,
            HttpHeaders.CONTENT_RANGE,
            HttpHeaders.CACHE_CONTROL);

    /**
     * Meldet eine fachliche Exception.
     *
     * @param response       Servlet-Antwort
     * @param currentHeaders bisher ausgehandelte Header der Anfrage
     * @param failure        Fehler
     * @param headOnly       {@code true} bei HEAD: Header ohne Body
     */
    public void report(
            HttpServletResponse response, HttpHeaders currentHeaders, StaticFileException failure, boolean headOnly) {

        write(
                response,
                currentHeaders,
                failure.getExtraHeaders(),
                failure.getStatusCode(),
                failure.getMessage(),
                headOnly);
    }

    /**
     * Meldet einen Fehler, den der Servlet-Container vor der Pipeline erkannt hat,
     * z. B. eine URI, die sich nicht normalisieren lässt.
     *
     * <p>Der Container hat Status und Fehlerzustand bereits gesetzt und den Puffer geleert;
     * ein {@code reset()} würde beides zurücksetzen und entfällt daher.</p>
     *
     * @param response       Container-Antwort, noch nicht festgeschrieben
     * @param currentHeaders Basis-Header
     * @param status         vom Container gesetzter Statuscode
     * @param message        Fehlertext des Containers, darf {@code null} sein
     * @param headOnly       {@code true} bei HEAD: Header ohne Body
     * @throws IOException wenn der Body nicht geschrieben werden kann
     */
    public void reportContainerError(
            HttpServletResponse response, HttpHeaders currentHeaders, int status, String message, boolean headOnly)
            throws IOException {

        ErrorPayload payload = payload(status, message);
        byte[] body = JacksonCodec.toJsonBytes(payload);
        deliver(response, errorIntent(currentHeaders, HttpHeaders.EMPTY, status, body.length), body, headOnly);
    }

    private static void write(
            HttpServletResponse response,
            HttpHeaders currentHeaders,
            HttpHeaders extraHeaders,
            int status,
            String message,
            boolean headOnly) {

        if (response.isCommitted()) {
            log.debug("Response already committed, dropping error {} ({})", status, message);
            return;
        }

        byte[] body = JacksonCodec.toJsonBytes(payload(status, message));
        try {
            // entfernt alles, was eine Stufe evtl. schon an der Antwort gesetzt hat
            response.reset();
            deliver(response, errorIntent(currentHeaders, extraHeaders, status, body.length), body, headOnly);
        } catch (IllegalStateException | IOException e) {
            log.debug("Could not deliver error {} ({}): {}", status, message, e.toString());
        }
    }

    private static void deliver(HttpServletResponse response, ResponseIntent intent, byte[] body, boolean headOnly)
            throws IOException {

        ServletResponses.apply(response, intent.status(), intent.headers());
        if (!headOnly) {
            response.getOutputStream().write(body);
        }
        response.flushBuffer();
    }

    private static ErrorPayload payload(int status, String message) {
        return new ErrorPayload(status, reasonPhrase(status), message != null ? message : "");
    }

    private static ResponseIntent errorIntent(
            HttpHeaders currentHeaders, HttpHeaders extraHeaders, int status, int contentLength) {

        return new ResponseIntent(
                status,
                errorHeaders(currentHeaders, extraHeaders, contentLength),
                BodyStrategy.ERROR_JSON,
                null,
                null);
    }

    private static HttpHeaders errorHeaders(HttpHeaders currentHeaders, HttpHeaders extraHeaders, int contentLength) {
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(currentHeaders);
        SUCCESS_ONLY_HEADERS.forEach(headers::remove);
        // erst nach dem Entfernen, damit z. B. "Content-Range: bytes */N" bei 416 erhalten bleibt
        extraHeaders.forEach(headers::put);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setContentLength(contentLength);
        headers.setCacheControl("no-cache");
        return headers;
    }

    private static String reasonPhrase(int status) {
        HttpStatus known = HttpStatus.resolve(status);
        return known != null ? known.getReasonPhrase() : "Unknown Status";
    }
}
