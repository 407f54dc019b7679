package de.htwsaar.ministatic.server.web;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministatic.server.config.DefaultHeaders;
import de.htwsaar.ministatic.server.service.ErrorReporter;
import java.util.Arrays;
import java.util.List;
import org.apache.catalina.Valve;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.core.StandardHost;
import org.apache.catalina.valves.ErrorReportValve;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.core.Ordered;

class TomcatContainerCustomizerTest {

    private final TomcatContainerCustomizer customizer =
            new TomcatContainerCustomizer(new ErrorReporter(), new DefaultHeaders());

    @Test
    void connectorLetsTraceThrough() {
        TomcatServletWebServerFactory factory = new TomcatServletWebServerFactory();
        customizer.customize(factory);

        Connector connector = new Connector();
        factory.getTomcatConnectorCustomizers().forEach(c -> c.customize(connector));

        assertTrue(connector.getAllowTrace());
        assertFalse(factory.getTomcatContextCustomizers().isEmpty());
    }

    @Test
    void htmlErrorValveIsReplacedByJsonValve() {
        StandardHost host = new StandardHost();
        host.getPipeline().addValve(new ErrorReportValve());

        customizer.installErrorValve(host);

        List<Valve> errorValves = Arrays.stream(host.getPipeline().getValves())
                .filter(ErrorReportValve.class::isInstance)
                .toList();
        assertEquals(1, errorValves.size());
        assertInstanceOf(JsonErrorReportValve.class, errorValves.get(0));
        assertEquals(JsonErrorReportValve.class.getName(), host.getErrorReportValveClass());
    }

    @Test
    void runsAfterSpringBootsOwnTomcatCustomizer() {
        assertEquals(Ordered.LOWEST_PRECEDENCE, customizer.getOrder());
    }
}
