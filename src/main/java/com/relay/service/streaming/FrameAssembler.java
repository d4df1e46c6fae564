package com.relay.service.streaming;

import com.relay.model.routing.FramingMode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reassembles complete framing units from arbitrary transport reads.
 *
 * Bytes after the last complete unit stay in a carry-over buffer until the next read. Boundaries are
 * found on raw bytes, so a multi-byte UTF-8 character split across reads is decoded intact.
 * For SSE a unit is the joined {@code data:} payload of one event; for NDJSON it is one non-blank line.
 * Not thread-safe: one assembler per stream.
 */
public class FrameAssembler {

    private final FramingMode mode;
    private byte[] buffer = new byte[1024];
    private int length;

    public FrameAssembler(FramingMode mode) {
        this.mode = mode;
    }

    /**
     * Append a read and return every unit it completed, in order.
     */
    public List<String> feed(byte[] chunk) {
        append(chunk);
        List<String> units = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < length; i++) {
            if (buffer[i] != '\n') {
                continue;
            }
            if (mode == FramingMode.NDJSON) {
                addLine(units, start, i);
                start = i + 1;
            } else {
                int next = i + 1;
                if (next < length && buffer[next] == '\r') {
                    next++;
                }
                if (next < length && buffer[next] == '\n') {
                    addEvent(units, start, i);
                    start = next + 1;
                    i = next;
                }
            }
        }
        compact(start);
        return units;
    }

    /**
     * Units left in the carry-over buffer when the transport closes.
     */
    public List<String> flush() {
        List<String> units = new ArrayList<>();
        if (length > 0) {
            if (mode == FramingMode.NDJSON) {
                addLine(units, 0, length);
            } else {
                addEvent(units, 0, length);
            }
            length = 0;
        }
        return units;
    }

    int pendingBytes() {
        return length;
    }

    private void addLine(List<String> units, int from, int to) {
        String line = new String(buffer, from, to - from, StandardCharsets.UTF_8).trim();
        if (!line.isEmpty()) {
            units.add(line);
        }
    }

    private void addEvent(List<String> units, int from, int to) {
        String event = new String(buffer, from, to - from, StandardCharsets.UTF_8);
        StringBuilder data = null;
        for (String rawLine : event.split("\n")) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            if (!line.startsWith("data:")) {
                continue; // event:, id:, retry: and ": comment" lines
            }
            String value = line.substring(5);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            if (data == null) {
                data = new StringBuilder(value);
            } else {
                data.append('\n').append(value);
            }
        }
        if (data != null && !data.toString().isBlank()) {
            units.add(data.toString());
        }
    }

    private void append(byte[] chunk) {
        if (length + chunk.length > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, length + chunk.length));
        }
        System.arraycopy(chunk, 0, buffer, length, chunk.length);
        length += chunk.length;
    }

    private void compact(int consumed) {
        if (consumed == 0) {
            return;
        }
        System.arraycopy(buffer, consumed, buffer, 0, length - consumed);
        length -= consumed;
    }
}
