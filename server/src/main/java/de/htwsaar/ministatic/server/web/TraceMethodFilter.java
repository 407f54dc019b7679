package de.htwsaar.ministatic.server.web;

import de.htwsaar.ministatic.server.service.StaticFilePipeline;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import org.springframework.http.HttpMethod;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gibt TRACE direkt an die Pipeline (405 als JSON) und beendet die Kette.
 *
 * <p>Das DispatcherServlet hängt nach jedem TRACE-Handler, der nicht {@code message/http}
 * liefert, das Echo von {@code HttpServlet.doTrace} an; daher darf TRACE es nicht erreichen.</p>
 */
public class TraceMethodFilter extends OncePerRequestFilter {

    private final StaticFilePipeline pipeline;

    public TraceMethodFilter(StaticFilePipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (HttpMethod.TRACE.matches(request.getMethod())) {
            pipeline.handle(request, response);
            return;
        }
        filterChain.doFilter(request, response);
    }
}
