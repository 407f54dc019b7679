package de.htwsaar.ministatic.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter zur Erzeugung und Verwaltung einer Trace-ID.
 *
 * <p>Für jede eingehende HTTP-Anfrage wird eine Trace-ID aus dem Request-Header
 * übernommen oder neu erzeugt und im MDC abgelegt, sodass sie automatisch in allen
 * Logeinträgen der Anfrage enthalten ist. Die Antwort bleibt unverändert.</p>
 *
 * <p>Client-Werte werden nur übernommen, wenn sie kurz sind und aus unkritischen Zeichen
 * bestehen; alles andere landet sonst ungefiltert im Log.</p>
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen werden kann */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        MDC.put(TRACE_ID_KEY, resolveTraceId(request.getHeader(TRACE_ID_HEADER)));

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Kontext nach der Anfrage wieder entfernen, der Thread wird wiederverwendet
            MDC.remove(TRACE_ID_KEY);
        }
    }

    /**
     * Übernimmt eine gültige Trace-ID des Clients oder erzeugt eine neue UUID.
     *
     * @param incoming Header-Wert (darf {@code null} sein)
     * @return zu verwendende Trace-ID
     */
    static String resolveTraceId(String incoming) {
        if (incoming != null) {
            String trimmed = incoming.trim();
            if (ACCEPTED_TRACE_ID.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }
}
