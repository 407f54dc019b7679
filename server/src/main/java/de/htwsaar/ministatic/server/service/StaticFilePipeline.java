package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.server.config.DefaultHeaders;
import de.htwsaar.ministatic.server.domain.BodyStrategy;
import de.htwsaar.ministatic.server.domain.MimeTypeResolver;
import de.htwsaar.ministatic.server.domain.Resource;
import de.htwsaar.ministatic.server.domain.ResponseIntent;
import de.htwsaar.ministatic.server.domain.StreamOutcome;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Collections;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

/**
 * Ablauf einer Anfrage: Validator → Resolver → CacheNegotiator → (RangeNegotiator | ContentEncoder)
 * → ResponseStreamer.
 *
 * <p>Jede Stufe liefert eine neue {@link ResponseIntent}; Header werden erst vom Streamer an die
 * Servlet-Antwort übergeben. {@link StaticFileException} wird genau hier gefangen und an den
 * {@link ErrorReporter} gegeben.</p>
 */
@Service
public class StaticFilePipeline {

    private static final Logger log = LoggerFactory.getLogger(StaticFilePipeline.class);

    private final RequestValidator requestValidator;
    private final ResourceResolver resourceResolver;
    private final MimeTypeResolver mimeTypeResolver;
    private final CacheNegotiator cacheNegotiator;
    private final RangeNegotiator rangeNegotiator;
    private final ContentEncoder contentEncoder;
    private final ResponseStreamer responseStreamer;
    private final ErrorReporter errorReporter;
    private final DefaultHeaders defaultHeaders;

    public StaticFilePipeline(
            RequestValidator requestValidator,
            ResourceResolver resourceResolver,
            MimeTypeResolver mimeTypeResolver,
            CacheNegotiator cacheNegotiator,
            RangeNegotiator rangeNegotiator,
            ContentEncoder contentEncoder,
            ResponseStreamer responseStreamer,
            ErrorReporter errorReporter,
            DefaultHeaders defaultHeaders) {

        this.requestValidator = Objects.requireNonNull(requestValidator, "requestValidator must not be null");
        this.resourceResolver = Objects.requireNonNull(resourceResolver, "resourceResolver must not be null");
        this.mimeTypeResolver = Objects.requireNonNull(mimeTypeResolver, "mimeTypeResolver must not be null");
        this.cacheNegotiator = Objects.requireNonNull(cacheNegotiator, "cacheNegotiator must not be null");
        this.rangeNegotiator = Objects.requireNonNull(rangeNegotiator, "rangeNegotiator must not be null");
        this.contentEncoder = Objects.requireNonNull(contentEncoder, "contentEncoder must not be null");
        this.responseStreamer = Objects.requireNonNull(responseStreamer, "responseStreamer must not be null");
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter must not be null");
        this.defaultHeaders = Objects.requireNonNull(defaultHeaders, "defaultHeaders must not be null");
    }

    /**
     * Beantwortet eine Anfrage vollständig.
     *
     * @param request  Servlet-Anfrage
     * @param response Servlet-Antwort
     * @throws ResponseAbortedException wenn nach dem Festschreiben der Header ein I/O-Fehler auftritt
     */
    public void handle(HttpServletRequest request, HttpServletResponse response) {
        boolean headOnly = HttpMethod.HEAD.matches(request.getMethod());
        HttpHeaders requestHeaders = requestHeaders(request);
        HttpHeaders current = defaultHeaders.newRequestHeaders();

        try {
            String path = requestValidator.validate(request.getProtocol(), request.getMethod(), pathOf(request));
            Resource resource = resourceResolver.resolve(path);

            // Endung des angefragten Namens, nicht des Symlink-Ziels
            current.set(HttpHeaders.CONTENT_TYPE, mimeTypeResolver.contentType(resource.name()));
            current.setContentLength(resource.size());

            ResponseIntent intent = cacheNegotiator.negotiate(resource, requestHeaders, current);
            current = intent.mutableHeaders();

            if (intent.strategy() == BodyStrategy.FULL) {
                intent = requestHeaders.containsKey(HttpHeaders.RANGE)
                        ? rangeNegotiator.negotiate(intent, resource, requestHeaders)
                        : contentEncoder.negotiate(intent, requestHeaders);
                current = intent.mutableHeaders();
            }
            log.debug("{} {} -> {} {}", request.getMethod(), path, intent.status(), intent.strategy());

            StreamOutcome outcome = responseStreamer.stream(intent, resource, headOnly, response);
            if (!outcome.isCompleted()) {
                onStreamFailure(path, outcome, response);
            }
        } catch (StaticFileException e) {
            if (e.getFailure() == StaticFileException.Failure.INTERNAL) {
                log.error("Internal error while serving {}: {}", request.getRequestURI(), e.getMessage(), e);
            }
            errorReporter.report(response, current, e, headOnly);
        }
    }

    private static void onStreamFailure(String path, StreamOutcome outcome, HttpServletResponse response) {
        if (response.isCommitted()) {
            log.warn(
                    "Aborting response for {} after {} bytes: {}",
                    path,
                    outcome.bytesWritten(),
                    outcome.failure().toString());
            throw new ResponseAbortedException(
                    "Streaming " + path + " failed after headers were sent", outcome.bytesWritten(), outcome.failure());
        }
        throw StaticFileException.internal(outcome.failure().getMessage(), outcome.failure());
    }

    /** Pfad ohne Context-Path; der Query-String ist in {@code getRequestURI()} nicht enthalten. */
    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (uri != null && contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    private static HttpHeaders requestHeaders(HttpServletRequest request) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            for (String value : Collections.list(request.getHeaders(name))) {
                headers.add(name, value);
            }
        }
        return headers;
    }
}
