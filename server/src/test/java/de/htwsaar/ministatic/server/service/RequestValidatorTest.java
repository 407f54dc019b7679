package de.htwsaar.ministatic.server.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RequestValidatorTest {

    private final RequestValidator validator = new RequestValidator();

    @ParameterizedTest
    @ValueSource(strings = {"/", "/index.html", "/a/b/c.tar.gz", "/docs/", "/.env", "/~user/file_1-2.txt", "/.config.d"})
    void acceptsWellFormedPaths(String path) {
        assertEquals(path, validator.validate("HTTP/1.1", "GET", path));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "x", "//", "/a//b", "/.", "/..", "/a/../b", "/a/./b", "/a%20b", "/a b", "/a.", "/a..b", "/a\\b"})
    void rejectsEverythingElse(String path) {
        StaticFileException e = assertThrows(
                StaticFileException.class, () -> validator.validate("HTTP/1.1", "GET", path));
        assertEquals(StaticFileException.Failure.INVALID_PATH, e.getFailure());
        assertEquals(400, e.getStatusCode());
    }

    @Test
    void stripsQueryBeforeMatching() {
        assertEquals("/app.js", validator.validate("HTTP/1.1", "HEAD", "/app.js?v=42&x=/../"));
    }

    @Test
    void checksVersionBeforeMethodBeforePath() {
        StaticFileException version =
                assertThrows(StaticFileException.class, () -> validator.validate("HTTP/1.0", "POST", "/../x"));
        assertEquals(505, version.getStatusCode());

        StaticFileException method =
                assertThrows(StaticFileException.class, () -> validator.validate("HTTP/1.1", "POST", "/../x"));
        assertEquals(405, method.getStatusCode());
        assertEquals("GET, HEAD", method.getExtraHeaders().getFirst("Allow"));
    }

    @Test
    void methodIsCaseSensitive() {
        assertThrows(StaticFileException.class, () -> validator.validate("HTTP/1.1", "get", "/"));
    }
}
