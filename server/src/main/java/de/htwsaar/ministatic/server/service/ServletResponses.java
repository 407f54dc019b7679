package de.htwsaar.ministatic.server.service;

import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;

final class ServletResponses {

    private ServletResponses() {
        // Utility
    }

    /** Überträgt Status und Header auf die noch nicht festgeschriebene Servlet-Antwort. */
    static void apply(HttpServletResponse response, int status, HttpHeaders headers) {
        response.setStatus(status);
        headers.forEach((name, values) -> {
            for (String value : values) {
                response.addHeader(name, value);
            }
        });
    }
}
