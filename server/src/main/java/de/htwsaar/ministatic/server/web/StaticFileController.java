package de.htwsaar.ministatic.server.web;

import de.htwsaar.ministatic.server.service.StaticFilePipeline;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;

/**
 * HTTP-Adapter für alle Pfade und alle Methoden.
 *
 * <p>Kein Fachcode hier. Methoden- und Pfadprüfung übernimmt die Pipeline selbst,
 * damit auch 405 und 400 im einheitlichen JSON-Format beantwortet werden.</p>
 *
 * <p>Die Methoden sind vollständig aufgezählt: ohne Methodenbedingung beantwortet
 * Spring MVC OPTIONS selbst, bevor die Pipeline läuft. TRACE erreicht den Controller nie,
 * das übernimmt der {@link TraceMethodFilter}.</p>
 */
@Controller
public class StaticFileController {

    private final StaticFilePipeline pipeline;

    /**
     * Constructor Injection.
     *
     * @param pipeline Ablauf pro Anfrage
     */
    public StaticFileController(StaticFilePipeline pipeline) {
        this.pipeline = pipeline;
    }

    @RequestMapping(
            path = "/**",
            method = {
                RequestMethod.GET,
                RequestMethod.HEAD,
                RequestMethod.POST,
                RequestMethod.PUT,
                RequestMethod.PATCH,
                RequestMethod.DELETE,
                RequestMethod.OPTIONS
            })
    public void serve(HttpServletRequest request, HttpServletResponse response) {
        pipeline.handle(request, response);
    }
}
