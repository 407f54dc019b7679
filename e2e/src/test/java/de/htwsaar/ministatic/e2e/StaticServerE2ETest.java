package de.htwsaar.ministatic.e2e;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministatic.common.serialization.JacksonCodec;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Läuft über echtes HTTP/1.1 gegen den eingebetteten Tomcat.
 */
class StaticServerE2ETest extends AbstractE2E {

    private static final HttpClient CLIENT =
            HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

    @Test
    @DisplayName("Große Datei kommt vollständig und byte-genau an")
    void fullDownload() throws Exception {
        HttpResponse<byte[]> response = send(request("/large.bin").GET().build());

        assertEquals(200, response.statusCode());
        assertArrayEquals(pattern(LARGE_SIZE), response.body());
        assertEquals(String.valueOf(LARGE_SIZE), header(response, "Content-Length"));
        assertEquals("application/octet-stream", header(response, "Content-Type"));
        assertEquals("public, max-age=60", header(response, "Cache-Control"));
        assertEquals("bytes", header(response, "Accept-Ranges"));
        assertEquals("nosniff", header(response, "X-Content-Type-Options"));
    }

    @Test
    void headMirrorsGetHeaders() throws Exception {
        HttpResponse<byte[]> get = send(request("/hello.txt").GET().build());
        HttpResponse<byte[]> head =
                send(request("/hello.txt").method("HEAD", HttpRequest.BodyPublishers.noBody()).build());

        assertEquals(200, head.statusCode());
        assertEquals(0, head.body().length);
        for (String name : new String[] {"Content-Type", "Content-Length", "ETag", "Last-Modified", "Cache-Control"}) {
            assertEquals(header(get, name), header(head, name), name);
        }
    }

    @Test
    void rootServesIndex() throws Exception {
        HttpResponse<byte[]> response = send(request("/").GET().build());

        assertEquals(200, response.statusCode());
        assertArrayEquals(Files.readAllBytes(rootDir.resolve("index.html")), response.body());
        assertTrue(header(response, "Content-Type").startsWith("text/html"));
    }

    @Test
    void revalidationYields304() throws Exception {
        HttpResponse<byte[]> first = send(request("/hello.txt").GET().build());
        String etag = header(first, "ETag");

        HttpResponse<byte[]> second =
                send(request("/hello.txt").header("If-None-Match", etag).GET().build());

        assertEquals(304, second.statusCode());
        assertEquals(0, second.body().length);
        assertEquals(etag, header(second, "ETag"));
    }

    @Test
    void singleRange() throws Exception {
        HttpResponse<byte[]> response =
                send(request("/large.bin").header("Range", "bytes=1000-1999").GET().build());

        assertEquals(206, response.statusCode());
        assertEquals("bytes 1000-1999/" + LARGE_SIZE, header(response, "Content-Range"));
        assertArrayEquals(Arrays.copyOfRange(pattern(LARGE_SIZE), 1000, 2000), response.body());
    }

    @Test
    void multipleRanges() throws Exception {
        HttpResponse<byte[]> response =
                send(request("/hello.txt").header("Range", "bytes=0-1,10-11").GET().build());

        assertEquals(206, response.statusCode());
        String contentType = header(response, "Content-Type");
        assertTrue(contentType.startsWith("multipart/byteranges"), contentType);
        String boundary = contentType.substring(contentType.indexOf("boundary=") + "boundary=".length());
        String body = new String(response.body(), StandardCharsets.ISO_8859_1);
        assertTrue(body.contains("Content-Range: bytes 0-1/20\r\n\r\n01\r\n--" + boundary), body);
        assertTrue(body.endsWith("Content-Range: bytes 10-11/20\r\n\r\nab\r\n--" + boundary + "--\r\n"), body);
    }

    @Test
    void unsatisfiableRange() throws Exception {
        HttpResponse<byte[]> response =
                send(request("/hello.txt").header("Range", "bytes=999999-1000000").GET().build());

        assertEquals(416, response.statusCode());
        assertEquals("bytes */20", header(response, "Content-Range"));
        Map<?, ?> json = JacksonCodec.fromJson(new String(response.body(), StandardCharsets.UTF_8), Map.class);
        assertEquals("Invalid range bytes=999999-1000000", json.get("message"));
    }

    @Test
    @DisplayName("gzip für HTML, identity für PNG")
    void compression() throws Exception {
        HttpResponse<byte[]> html =
                send(request("/index.html").header("Accept-Encoding", "gzip").GET().build());

        assertEquals("gzip", header(html, "Content-Encoding"));
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(html.body()))) {
            assertArrayEquals(Files.readAllBytes(rootDir.resolve("index.html")), in.readAllBytes());
        }

        HttpResponse<byte[]> png =
                send(request("/img/pixel.png").header("Accept-Encoding", "gzip").GET().build());

        assertNull(header(png, "Content-Encoding"));
        assertEquals("image/png", header(png, "Content-Type"));
        assertEquals(8, png.body().length);
    }

    @Test
    void errorsAreJson() throws Exception {
        HttpResponse<byte[]> missing = send(request("/nope.txt").GET().build());
        assertEquals(404, missing.statusCode());
        assertTrue(header(missing, "Content-Type").startsWith("application/json"));
        Map<?, ?> json = JacksonCodec.fromJson(new String(missing.body(), StandardCharsets.UTF_8), Map.class);
        assertEquals(404, json.get("status"));
        assertEquals("Not Found", json.get("statusMessage"));
        assertEquals("Not found: /nope.txt", json.get("message"));

        HttpResponse<byte[]> post =
                send(request("/hello.txt").POST(HttpRequest.BodyPublishers.ofString("x")).build());
        assertEquals(405, post.statusCode());
        assertEquals("GET, HEAD", header(post, "Allow"));
    }

    @Test
    void traversalIsRejected() throws Exception {
        assertEquals(400, send(request("/img/../hello.txt").GET().build()).statusCode());
        assertEquals(400, send(request("/img/./pixel.png").GET().build()).statusCode());

        // scheitert schon an der URI-Normalisierung von Tomcat, muss aber trotzdem JSON liefern
        RawResponse escape = sendRaw("GET /../etc/passwd HTTP/1.1");
        assertEquals(400, escape.status());
        assertTrue(escape.header("Content-Type").startsWith("application/json"), escape.header("Content-Type"));
        assertEquals("no-cache", escape.header("Cache-Control"));
        assertEquals("*", escape.header("Access-Control-Allow-Origin"));
        assertEquals(String.valueOf(escape.body().length()), escape.header("Content-Length"));
        Map<?, ?> json = JacksonCodec.fromJson(escape.body(), Map.class);
        assertEquals(400, json.get("status"));
        assertEquals("Bad Request", json.get("statusMessage"));
        assertFalse(escape.body().contains("root:"));
    }

    private static HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(base + path));
    }

    private static HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException {
        return CLIENT.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    private static String header(HttpResponse<?> response, String name) {
        HttpHeaders headers = response.headers();
        return headers.firstValue(name).orElse(null);
    }
}
