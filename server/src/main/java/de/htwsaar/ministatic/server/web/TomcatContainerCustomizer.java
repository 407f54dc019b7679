package de.htwsaar.ministatic.server.web;

import de.htwsaar.ministatic.server.config.DefaultHeaders;
import de.htwsaar.ministatic.server.service.ErrorReporter;
import java.util.Objects;
import org.apache.catalina.Pipeline;
import org.apache.catalina.Valve;
import org.apache.catalina.core.StandardHost;
import org.apache.catalina.valves.ErrorReportValve;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.core.Ordered;

/**
 * Passt den eingebetteten Tomcat so an, dass jede Antwort dem JSON-Fehlerformat folgt.
 *
 * <ul>
 *   <li>TRACE wird vom Connector nicht mehr abgewiesen, sondern erreicht die Pipeline (405).</li>
 *   <li>Die HTML-Fehlerseite des Hosts wird durch {@link JsonErrorReportValve} ersetzt.</li>
 * </ul>
 *
 * <p>Läuft nach Spring Boots eigenem Tomcat-Customizer, der bereits ein
 * {@link ErrorReportValve} am Host einträgt; dieses wird hier wieder entfernt.</p>
 */
public class TomcatContainerCustomizer implements WebServerFactoryCustomizer<TomcatServletWebServerFactory>, Ordered {

    private final ErrorReporter errorReporter;
    private final DefaultHeaders defaultHeaders;

    public TomcatContainerCustomizer(ErrorReporter errorReporter, DefaultHeaders defaultHeaders) {
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter must not be null");
        this.defaultHeaders = Objects.requireNonNull(defaultHeaders, "defaultHeaders must not be null");
    }

    @Override
    public void customize(TomcatServletWebServerFactory factory) {
        factory.addConnectorCustomizers(connector -> connector.setAllowTrace(true));
        factory.addContextCustomizers(context -> installErrorValve((StandardHost) context.getParent()));
    }

    void installErrorValve(StandardHost host) {
        Pipeline pipeline = host.getPipeline();
        for (Valve valve : pipeline.getValves()) {
            if (valve instanceof ErrorReportValve) {
                pipeline.removeValve(valve);
            }
        }
        // der Host legt beim Start nur dann ein eigenes Valve an, wenn keines dieser Klasse existiert
        host.setErrorReportValveClass(JsonErrorReportValve.class.getName());
        pipeline.addValve(new JsonErrorReportValve(errorReporter, defaultHeaders));
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
