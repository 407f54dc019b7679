package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.server.domain.ByteRange;
import java.nio.charset.StandardCharsets;

/**
 * Rahmen eines {@code multipart/byteranges}-Bodys (RFC 7233, Anhang A).
 *
 * <pre>
 * --B CRLF
 * Content-Type: text/plain CRLF
 * Content-Range: bytes 0-9/100 CRLF
 * CRLF
 * &lt;Bytes&gt; CRLF
 * --B CRLF
 * ...
 * &lt;Bytes&gt; CRLF
 * --B-- CRLF
 * </pre>
 */
final class MultipartByteRangesEncoder {

    private static final String CRLF = "\r\n";

    private final String boundary;
    private final String partContentType;
    private final long totalSize;

    MultipartByteRangesEncoder(String boundary, String partContentType, long totalSize) {
        this.boundary = boundary;
        this.partContentType = partContentType;
        this.totalSize = totalSize;
    }

    /**
     * Kopfzeilen eines Teils; ab dem zweiten Teil mit dem CRLF, das die Bytes des Vorgängers abschließt.
     */
    byte[] partHeader(ByteRange range, boolean first) {
        String header = (first ? "" : CRLF)
                + "--" + boundary + CRLF
                + "Content-Type: " + partContentType + CRLF
                + "Content-Range: " + range.contentRange(totalSize) + CRLF
                + CRLF;
        return header.getBytes(StandardCharsets.US_ASCII);
    }

    /** Abschluss nach dem letzten Teil. */
    byte[] closeDelimiter() {
        return (CRLF + "--" + boundary + "--" + CRLF).getBytes(StandardCharsets.US_ASCII);
    }
}
