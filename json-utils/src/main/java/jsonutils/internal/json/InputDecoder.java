package jsonutils.internal.json;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/// Turns a byte stream into a character stream for the parser.
///
/// A leading byte-order mark selects UTF-8, UTF-16 or UTF-32 and is dropped;
/// without one the bytes are read as UTF-8. Malformed sequences become U+FFFD.
final class InputDecoder {

    private static final Logger LOGGER = Logger.getLogger(InputDecoder.class.getName());

    private static final int MAX_BOM_LENGTH = 4;

    private InputDecoder() {
    }

    static Reader decode(InputStream in) {
        final var buffered = in instanceof BufferedInputStream b ? b : new BufferedInputStream(in);
        try {
            buffered.mark(MAX_BOM_LENGTH);
            final byte[] head = buffered.readNBytes(MAX_BOM_LENGTH);
            buffered.reset();
            final Bom bom = detectBom(head);
            if (bom.length() > 0) {
                LOGGER.fine(() -> "BOM detected: " + bom.charset().name());
                buffered.skipNBytes(bom.length());
            }
            return new BufferedReader(new InputStreamReader(buffered, bom.charset()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON input", e);
        }
    }

    static Bom detectBom(byte[] head) {
        if (startsWith(head, 0x00, 0x00, 0xFE, 0xFF)) {
            return new Bom(Charset.forName("UTF-32BE"), 4);
        }
        if (startsWith(head, 0xFF, 0xFE, 0x00, 0x00)) {
            return new Bom(Charset.forName("UTF-32LE"), 4);
        }
        if (startsWith(head, 0xEF, 0xBB, 0xBF)) {
            return new Bom(StandardCharsets.UTF_8, 3);
        }
        if (startsWith(head, 0xFE, 0xFF)) {
            return new Bom(StandardCharsets.UTF_16BE, 2);
        }
        if (startsWith(head, 0xFF, 0xFE)) {
            return new Bom(StandardCharsets.UTF_16LE, 2);
        }
        return new Bom(StandardCharsets.UTF_8, 0);
    }

    private static boolean startsWith(byte[] bytes, int... prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((bytes[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    record Bom(Charset charset, int length) {}
}
