package com.queryinsight.ask.service.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Incremental parser for the AI service's text stream.
 *
 * <pre>
 * stream := frame* [partial]
 * frame  := line+ "\n\n"            ('\r' is ignored)
 * line   := "data:" SP* json | other
 * json   := {"message": "&lt;fragment&gt;", ...}
 * </pre>
 *
 * Chunks are buffered as bytes and only complete frames are decoded, so a frame or a
 * multi-byte character straddling two chunks is never parsed early. Cancelling the
 * returned {@link Flux} cancels the upstream byte stream and releases its connection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkProtocolParser {

    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper objectMapper;

    /**
     * Text fragments of the byte stream, in arrival order.
     */
    public Flux<String> parse(Flux<byte[]> chunks) {
        return Flux.defer(() -> {
            FrameBuffer buffer = new FrameBuffer();
            return chunks
                    .concatMapIterable(chunk -> extractFragments(buffer.append(chunk)))
                    .concatWith(Flux.defer(() -> Flux.fromIterable(extractFragments(buffer.drain()))))
                    .doOnCancel(() -> log.debug("Provider text stream cancelled"));
        });
    }

    private List<String> extractFragments(List<String> frames) {
        List<String> fragments = new ArrayList<>();
        for (String frame : frames) {
            for (String line : frame.split("\n")) {
                String fragment = parseLine(line);
                if (fragment != null && !fragment.isEmpty()) {
                    fragments.add(fragment);
                }
            }
        }
        return fragments;
    }

    private String parseLine(String line) {
        if (!line.startsWith(DATA_PREFIX)) {
            return null;
        }
        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (payload.isEmpty() || DONE_MARKER.equals(payload)) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            JsonNode message = node.get("message");
            return message != null && message.isTextual() ? message.asText() : null;
        } catch (Exception e) {
            log.warn("Skipping malformed stream frame: {}", abbreviate(payload));
            return null;
        }
    }

    private static String abbreviate(String value) {
        return value.length() > 200 ? value.substring(0, 200) + "..." : value;
    }

    /**
     * Carry-over buffer for one stream. Not thread-safe; chunks arrive sequentially.
     *
     * Bytes before {@code scanned} are known to hold no frame delimiter, so each byte is
     * checked once however many chunks a long frame arrives in.
     */
    static final class FrameBuffer {

        private byte[] pending = new byte[1024];
        private int size;
        private int scanned;

        /**
         * Appends a chunk and returns the frames it completed.
         */
        List<String> append(byte[] chunk) {
            ensureCapacity(size + chunk.length);
            for (byte b : chunk) {
                if (b != '\r') {
                    pending[size++] = b;
                }
            }
            return takeCompleteFrames();
        }

        /**
         * Returns what is left once the stream has ended.
         */
        List<String> drain() {
            List<String> frames = takeCompleteFrames();
            if (size > 0) {
                frames.add(new String(pending, 0, size, StandardCharsets.UTF_8));
                size = 0;
                scanned = 0;
            }
            return frames;
        }

        private List<String> takeCompleteFrames() {
            List<String> frames = new ArrayList<>();
            int frameStart = 0;
            int i = scanned;
            for (; i + 1 < size; i++) {
                if (pending[i] == '\n' && pending[i + 1] == '\n') {
                    if (i > frameStart) {
                        frames.add(new String(pending, frameStart, i - frameStart, StandardCharsets.UTF_8));
                    }
                    frameStart = i + 2;
                    i++;
                }
            }
            scanned = i;
            if (frameStart > 0) {
                System.arraycopy(pending, frameStart, pending, 0, size - frameStart);
                size -= frameStart;
                scanned -= frameStart;
            }
            return frames;
        }

        private void ensureCapacity(int required) {
            if (required > pending.length) {
                pending = Arrays.copyOf(pending, Math.max(required, pending.length * 2));
            }
        }
    }
}
