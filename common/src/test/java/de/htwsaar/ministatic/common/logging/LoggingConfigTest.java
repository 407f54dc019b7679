package de.htwsaar.ministatic.common.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.core.Ordered;

/**
 * Tests für {@link LoggingConfig}.
 *
 * <p>Ziel: sicherstellen, dass der Filter vor allen anderen Filtern läuft.</p>
 */
class LoggingConfigTest {

    @Test
    void shouldCreateTraceIdFilterBeanInstance() {
        LoggingConfig config = new LoggingConfig();

        assertNotNull(config.traceIdFilter());
    }

    @Test
    void shouldRegisterFilterWithHighestPrecedence() {
        LoggingConfig config = new LoggingConfig();
        TraceIdFilter filter = config.traceIdFilter();

        FilterRegistrationBean<TraceIdFilter> registration = config.traceIdFilterRegistration(filter);

        assertSame(filter, registration.getFilter());
        assertEquals(Ordered.HIGHEST_PRECEDENCE, registration.getOrder());
    }
}
