package de.htwsaar.ministatic.server.web;

import de.htwsaar.ministatic.server.config.DefaultHeaders;
import de.htwsaar.ministatic.server.service.ErrorReporter;
import java.io.IOException;
import java.util.Objects;
import org.apache.catalina.connector.Request;
import org.apache.catalina.connector.Response;
import org.apache.catalina.valves.ErrorReportValve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;

/**
 * Ersetzt die HTML-Fehlerseite von Tomcat auf Host-Ebene.
 *
 * <p>Greift nur bei Fehlern, die der Container selbst auslöst, bevor die Pipeline läuft
 * (z. B. {@code GET /../etc/passwd}, das an der URI-Normalisierung scheitert). Antworten der
 * Pipeline tragen bereits einen Body oder sind nicht als Fehler markiert und bleiben unberührt.</p>
 */
public class JsonErrorReportValve extends ErrorReportValve {

    private static final Logger log = LoggerFactory.getLogger(JsonErrorReportValve.class);

    private final ErrorReporter errorReporter;
    private final DefaultHeaders defaultHeaders;

    public JsonErrorReportValve(ErrorReporter errorReporter, DefaultHeaders defaultHeaders) {
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter must not be null");
        this.defaultHeaders = Objects.requireNonNull(defaultHeaders, "defaultHeaders must not be null");
    }

    @Override
    protected void report(Request request, Response response, Throwable throwable) {
        int status = response.getStatus();
        if (status < 400 || response.getContentWritten() > 0 || !response.setErrorReported()) {
            return;
        }

        log.debug("Container rejected {} {} with {}", request.getMethod(), request.getRequestURI(), status);
        try {
            errorReporter.reportContainerError(
                    response,
                    defaultHeaders.newRequestHeaders(),
                    status,
                    response.getMessage(),
                    HttpMethod.HEAD.matches(request.getMethod()));
            response.finishResponse();
        } catch (IOException | IllegalStateException e) {
            log.debug("Could not deliver container error {}: {}", status, e.toString());
        }
    }
}
