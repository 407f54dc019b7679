package de.htwsaar.ministatic.server.service;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministatic.server.domain.ByteRange;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class MultipartByteRangesEncoderTest {

    private final MultipartByteRangesEncoder encoder =
            new MultipartByteRangesEncoder("3d6b6a416f9b5", "text/plain; charset=utf-8", 100);

    @Test
    void firstPartHasNoLeadingCrlf() {
        assertEquals(
                "--3d6b6a416f9b5\r\n"
                        + "Content-Type: text/plain; charset=utf-8\r\n"
                        + "Content-Range: bytes 0-9/100\r\n"
                        + "\r\n",
                ascii(encoder.partHeader(new ByteRange(0, 9), true)));
    }

    @Test
    void laterPartsCloseThePreviousBody() {
        assertTrue(ascii(encoder.partHeader(new ByteRange(50, 99), false))
                .startsWith("\r\n--3d6b6a416f9b5\r\nContent-Type: text/plain; charset=utf-8\r\nContent-Range: bytes 50-99/100\r\n"));
    }

    @Test
    void closeDelimiter() {
        assertEquals("\r\n--3d6b6a416f9b5--\r\n", ascii(encoder.closeDelimiter()));
    }

    private static String ascii(byte[] bytes) {
        return new String(bytes, StandardCharsets.US_ASCII);
    }
}
