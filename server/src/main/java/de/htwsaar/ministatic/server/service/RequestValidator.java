package de.htwsaar.ministatic.server.service;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Erste Pipeline-Stufe: weist fehlerhafte Anfragen ab, bevor das Dateisystem berührt wird.
 *
 * <p>Die Pfad-Grammatik ist die einzige Sperre gegen Directory-Traversal auf Anfrageebene:
 * nur Segmente aus {@code [A-Za-z0-9_~-]} mit optionalen Endungen, keine leeren Segmente,
 * kein {@code .} oder {@code ..}, keine Prozent-Kodierung.</p>
 */
@Component
public class RequestValidator {

    static final String SUPPORTED_PROTOCOL = "HTTP/1.1";

    private static final String CHARS = "[A-Za-z0-9_~-]";
    private static final String SEGMENT = "(?:" + CHARS + "+(?:\\." + CHARS + "+)*|(?:\\." + CHARS + "+)+)";
    private static final Pattern PATH = Pattern.compile("^/(?:" + SEGMENT + "(?:/" + SEGMENT + ")*/?)?$");

    /**
     * Prüft Protokollversion, Methode und Pfad in genau dieser Reihenfolge.
     *
     * @param protocol Protokoll der Anfrage, z. B. {@code HTTP/1.1}
     * @param method   HTTP-Methode
     * @param rawPath  Pfad wie empfangen, ggf. mit Query-String
     * @return geprüfter Pfad ohne Query-String
     * @throws StaticFileException mit VERSION_UNSUPPORTED, METHOD_NOT_ALLOWED oder INVALID_PATH
     */
    public String validate(String protocol, String method, String rawPath) {
        if (!SUPPORTED_PROTOCOL.equals(protocol)) {
            throw StaticFileException.versionUnsupported();
        }
        if (!"GET".equals(method) && !"HEAD".equals(method)) {
            throw StaticFileException.methodNotAllowed();
        }

        String path = stripQuery(rawPath);
        if (!PATH.matcher(path).matches()) {
            throw StaticFileException.invalidPath(path);
        }
        return path;
    }

    private static String stripQuery(String rawPath) {
        if (rawPath == null) return "";
        int query = rawPath.indexOf('?');
        return query >= 0 ? rawPath.substring(0, query) : rawPath;
    }
}
