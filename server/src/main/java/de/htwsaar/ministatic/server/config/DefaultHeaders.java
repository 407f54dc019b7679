package de.htwsaar.ministatic.server.config;

import org.springframework.http.HttpHeaders;

/**
 * Fester Header-Satz, der jeder Antwort vorangestellt wird.
 *
 * <p>Die Basis ist schreibgeschützt; jede Anfrage arbeitet auf ihrer eigenen Kopie.</p>
 */
public final class DefaultHeaders {

    public static final String ALLOWED_METHODS = "GET, HEAD";

    private final HttpHeaders base;

    public DefaultHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.ACCEPT_RANGES, "bytes");
        h.set(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        h.set(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS);
        h.set("X-Content-Type-Options", "nosniff");
        h.set(HttpHeaders.VARY, HttpHeaders.ACCEPT_ENCODING);
        this.base = HttpHeaders.readOnlyHttpHeaders(h);
    }

    HttpHeaders base() {
        return base;
    }

    /** Neue, veränderbare Kopie für genau eine Anfrage. */
    public HttpHeaders newRequestHeaders() {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(base);
        return copy;
    }
}
