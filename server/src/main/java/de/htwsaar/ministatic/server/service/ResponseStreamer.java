package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.server.domain.BodyStrategy;
import de.htwsaar.ministatic.server.domain.ByteRange;
import de.htwsaar.ministatic.server.domain.FileStore;
import de.htwsaar.ministatic.server.domain.Resource;
import de.htwsaar.ministatic.server.domain.ResponseIntent;
import de.htwsaar.ministatic.server.domain.StreamOutcome;
import jakarta.servlet.http.HttpServletResponse;
import java.io.EOFException;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;
import java.util.zip.GZIPOutputStream;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * Führt die gewählte Body-Strategie aus.
 *
 * <p>Die Datei wird vor dem Festschreiben der Header geöffnet; scheitert das, ist die Antwort
 * noch frei für eine Fehlermeldung. Danach wird blockierend geschrieben, ein voller
 * Socket-Puffer bremst also das Lesen der Datei. I/O-Fehler werden nicht geworfen, sondern
 * als {@link StreamOutcome} zurückgegeben; der Aufrufer entscheidet anhand von
 * {@link HttpServletResponse#isCommitted()}, ob noch gemeldet oder abgebrochen wird.</p>
 */
@Component
public class ResponseStreamer {

    private final FileStore fileStore;

    public ResponseStreamer(FileStore fileStore) {
        this.fileStore = Objects.requireNonNull(fileStore, "fileStore must not be null");
    }

    /**
     * @param intent   Entscheidung der Negotiation
     * @param resource aufgelöste Ressource
     * @param headOnly {@code true} bei HEAD: gleiche Header, kein Body
     * @param response Servlet-Antwort, noch nicht festgeschrieben
     * @return Ergebnis des Schreibvorgangs
     */
    public StreamOutcome stream(
            ResponseIntent intent, Resource resource, boolean headOnly, HttpServletResponse response) {

        if (headOnly || intent.strategy() == BodyStrategy.NONE) {
            ServletResponses.apply(response, intent.status(), intent.headers());
            return StreamOutcome.completed(0);
        }

        return switch (intent.strategy()) {
            case FULL, FULL_GZIP -> streamWindow(intent, resource, 0, resource.size(), response);
            case SINGLE_RANGE -> {
                ByteRange range = intent.ranges().get(0);
                yield streamWindow(intent, resource, range.start(), range.length(), response);
            }
            case MULTIPART -> streamMultipart(intent, resource, response);
            default -> throw new IllegalArgumentException("Unsupported body strategy: " + intent.strategy());
        };
    }

    private StreamOutcome streamWindow(
            ResponseIntent intent, Resource resource, long offset, long length, HttpServletResponse response) {

        PayloadCounter payload = null;
        try (InputStream in = fileStore.open(resource.path(), offset)) {
            commit(intent, response);
            OutputStream out = response.getOutputStream();
            if (intent.strategy() == BodyStrategy.FULL_GZIP) {
                // nonClosing: gzip.close() schreibt den Trailer, der Servlet-Stream bleibt dem Container
                try (GZIPOutputStream gzip = new GZIPOutputStream(StreamUtils.nonClosing(out), StreamUtils.BUFFER_SIZE)) {
                    payload = new PayloadCounter(gzip);
                    copyExactly(in, payload, length);
                }
            } else {
                payload = new PayloadCounter(out);
                copyExactly(in, payload, length);
            }
            out.flush();
            return StreamOutcome.completed(payload.count);
        } catch (IOException e) {
            return StreamOutcome.failed(payload != null ? payload.count : 0, e);
        }
    }

    private StreamOutcome streamMultipart(ResponseIntent intent, Resource resource, HttpServletResponse response) {
        ResponseIntent.Multipart multipart = intent.multipart();
        MultipartByteRangesEncoder encoder =
                new MultipartByteRangesEncoder(multipart.boundary(), multipart.partContentType(), resource.size());
        List<ByteRange> ranges = intent.ranges();

        PayloadCounter payload = null;
        try (InputStream firstPart = fileStore.open(resource.path(), ranges.get(0).start())) {
            commit(intent, response);
            OutputStream out = response.getOutputStream();
            payload = new PayloadCounter(out);

            writePart(out, payload, encoder, ranges.get(0), true, firstPart);
            for (ByteRange range : ranges.subList(1, ranges.size())) {
                try (InputStream in = fileStore.open(resource.path(), range.start())) {
                    writePart(out, payload, encoder, range, false, in);
                }
            }

            out.write(encoder.closeDelimiter());
            out.flush();
            return StreamOutcome.completed(payload.count);
        } catch (IOException e) {
            return StreamOutcome.failed(payload != null ? payload.count : 0, e);
        }
    }

    private static void writePart(
            OutputStream out,
            PayloadCounter payload,
            MultipartByteRangesEncoder encoder,
            ByteRange range,
            boolean first,
            InputStream in)
            throws IOException {

        out.write(encoder.partHeader(range, first));
        copyExactly(in, payload, range.length());
        // Teil vollständig abgeben, bevor der nächste Rahmen geschrieben wird
        out.flush();
    }

    private static void commit(ResponseIntent intent, HttpServletResponse response) throws IOException {
        ServletResponses.apply(response, intent.status(), intent.headers());
        response.flushBuffer();
    }

    private static void copyExactly(InputStream in, OutputStream out, long length) throws IOException {
        if (length == 0) return;

        long copied = StreamUtils.copyRange(in, out, 0, length - 1);
        if (copied < length) {
            throw new EOFException("File ended after " + copied + " of " + length + " bytes");
        }
    }

    /** Zählt die Nutzdaten-Bytes, die tatsächlich an den Ziel-Stream gegangen sind; Rahmen laufen daran vorbei. */
    private static final class PayloadCounter extends FilterOutputStream {

        private long count;

        PayloadCounter(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }
    }
}
