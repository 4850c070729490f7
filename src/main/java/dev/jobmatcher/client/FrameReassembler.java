package dev.jobmatcher.client;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits an incoming byte stream into complete SSE frames.
 * Bytes after the last blank-line terminator are held until more input arrives,
 * so a multi-byte character split across reads is decoded only once whole.
 * Each byte is scanned once; only the tail that could still start a terminator is revisited.
 * Not thread-safe; one instance per stream.
 */
public class FrameReassembler {

    private static final int LONGEST_TERMINATOR = 4;

    private byte[] buffer = new byte[1024];
    private int length;
    private int scanFrom;

    /**
     * Append a chunk and return every frame it completes, without terminators.
     */
    public List<String> feed(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return List.of();
        }
        append(chunk);
        List<String> frames = new ArrayList<>();

        int frameStart = 0;
        int i = scanFrom;
        while (i < length) {
            int terminatorLength = terminatorAt(i);
            if (terminatorLength > 0) {
                frames.add(new String(buffer, frameStart, i - frameStart, StandardCharsets.UTF_8));
                i += terminatorLength;
                frameStart = i;
            } else {
                i++;
            }
        }

        if (frameStart > 0) {
            System.arraycopy(buffer, frameStart, buffer, 0, length - frameStart);
            length -= frameStart;
        }
        scanFrom = Math.max(0, length - (LONGEST_TERMINATOR - 1));
        return frames;
    }

    public int pendingBytes() {
        return length;
    }

    /**
     * Text of an unterminated trailing frame, if any.
     */
    public String remainder() {
        return new String(buffer, 0, length, StandardCharsets.UTF_8);
    }

    private int terminatorAt(int i) {
        if (buffer[i] == '\n' && i + 1 < length && buffer[i + 1] == '\n') {
            return 2;
        }
        if (buffer[i] == '\r' && i + 3 < length
                && buffer[i + 1] == '\n' && buffer[i + 2] == '\r' && buffer[i + 3] == '\n') {
            return 4;
        }
        return 0;
    }

    private void append(byte[] chunk) {
        if (length + chunk.length > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, length + chunk.length));
        }
        System.arraycopy(chunk, 0, buffer, length, chunk.length);
        length += chunk.length;
    }
}
