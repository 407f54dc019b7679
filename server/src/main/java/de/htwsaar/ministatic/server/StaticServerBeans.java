package de.htwsaar.ministatic.server;

import de.htwsaar.ministatic.server.adapter.LocalFileStore;
import de.htwsaar.ministatic.server.adapter.SpringMimeTypeResolver;
import de.htwsaar.ministatic.server.adapter.SpringRangeParser;
import de.htwsaar.ministatic.server.config.DefaultHeaders;
import de.htwsaar.ministatic.server.config.StaticServerConfig;
import de.htwsaar.ministatic.server.domain.FileStore;
import de.htwsaar.ministatic.server.domain.MimeTypeResolver;
import de.htwsaar.ministatic.server.domain.RangeParser;
import de.htwsaar.ministatic.server.service.ErrorReporter;
import de.htwsaar.ministatic.server.service.StaticFilePipeline;
import de.htwsaar.ministatic.server.web.TomcatContainerCustomizer;
import de.htwsaar.ministatic.server.web.TraceMethodFilter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Zentrale Spring-Verdrahtung des Servers.
 *
 * <p>Schichtung: Controller → Pipeline → Stufen → Ports → Adapter</p>
 */
@Configuration
public class StaticServerBeans {

    private static final Logger log = LoggerFactory.getLogger(StaticServerBeans.class);

    /**
     * Liest die Startkonfiguration und kanonisiert das Wurzelverzeichnis genau einmal.
     *
     * @param rootDir         Wurzelverzeichnis (Standard: "public")
     * @param defaultIndex    Index-Datei für Verzeichnisse (Standard: "index.html")
     * @param cacheMaxAgeSecs Cache-TTL in Sekunden (Standard: 600)
     * @return unveränderliche {@link StaticServerConfig}
     * @throws IllegalStateException wenn das Wurzelverzeichnis fehlt oder kein Verzeichnis ist
     */
    @Bean
    public StaticServerConfig staticServerConfig(
            @Value("${ministatic.root-dir:public}") String rootDir,
            @Value("${ministatic.default-index:index.html}") String defaultIndex,
            @Value("${ministatic.cache-max-age:600}") long cacheMaxAgeSecs) {

        Path root;
        try {
            root = Path.of(rootDir).toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("Root directory not accessible: " + rootDir, e);
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalStateException("Root directory is not a directory: " + root);
        }

        StaticServerConfig config = new StaticServerConfig(root, defaultIndex.trim(), cacheMaxAgeSecs);
        log.info(
                "Serving {} (index: {}, max-age: {}s)",
                config.rootDir(),
                config.defaultIndex(),
                config.cacheMaxAgeSecs());
        return config;
    }

    @Bean
    public DefaultHeaders defaultHeaders() {
        return new DefaultHeaders();
    }

    @Bean
    public FileStore fileStore() {
        return new LocalFileStore();
    }

    @Bean
    public MimeTypeResolver mimeTypeResolver() {
        return new SpringMimeTypeResolver();
    }

    @Bean
    public RangeParser rangeParser() {
        return new SpringRangeParser();
    }

    /** TRACE vom Connector durchlassen und Container-Fehler als JSON beantworten. */
    @Bean
    public TomcatContainerCustomizer tomcatContainerCustomizer(
            ErrorReporter errorReporter, DefaultHeaders defaultHeaders) {
        return new TomcatContainerCustomizer(errorReporter, defaultHeaders);
    }

    /** Direkt nach dem TraceIdFilter, damit auch TRACE-Anfragen eine Trace-ID im Log tragen. */
    @Bean
    public FilterRegistrationBean<TraceMethodFilter> traceMethodFilterRegistration(StaticFilePipeline pipeline) {
        FilterRegistrationBean<TraceMethodFilter> registration =
                new FilterRegistrationBean<>(new TraceMethodFilter(pipeline));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);
        return registration;
    }
}
