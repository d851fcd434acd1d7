package io.timeline.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.timeline.core.Event;
import io.timeline.core.EventCodec;
import io.timeline.core.Hlc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable store backed by a newline-delimited JSON file, one event per line, appended at the tail.
 *
 * <p>A crash mid-append can leave an unterminated last line. Opening the store and every append
 * repair it first: the fragment is newline-terminated when it decodes, truncated otherwise. Readers skip blank lines and
 * an undecodable final record; an undecodable record before the end is reported as corruption.
 * When an id appears more than once the last record wins, at the position of the first.
 */
public final class JsonLinesEventStore extends AbstractEventStore {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesEventStore.class);

    private final Path file;
    private final EventCodec codec;

    public JsonLinesEventStore(Path file, ObjectMapper json, EventProcessor processor) {
        super(processor);
        this.file = Objects.requireNonNull(file, "file");
        this.codec = new EventCodec(json);
        open();
    }

    public JsonLinesEventStore(Path file, EventProcessor processor) {
        this(file, new ObjectMapper(), processor);
    }

    public Path file() { return file; }

    private void open() {
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            if (Files.notExists(file)) Files.createFile(file);
            try (var ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                repairTail(ch);
            }
        } catch (IOException e) {
            throw new EventStoreException("Cannot open event log " + file, e);
        }
    }

    private void repairTail(FileChannel ch) throws IOException {
        long size = ch.size();
        if (size == 0 || lastByte(ch, size) == '\n') return;

        long start = size;
        while (start > 0 && lastByte(ch, start) != '\n') start--;
        var tail = ByteBuffer.allocate((int) (size - start));
        ch.read(tail, start);
        var fragment = new String(tail.array(), StandardCharsets.UTF_8);

        if (fragment.isBlank() || decodes(fragment)) {
            ch.write(ByteBuffer.wrap(new byte[]{'\n'}), size);
            log.warn("Terminated unfinished last line of {}", file);
        } else {
            ch.truncate(start);
            log.warn("Dropped torn record ({} bytes) at the end of {}", size - start, file);
        }
    }

    private static byte lastByte(FileChannel ch, long end) throws IOException {
        var b = ByteBuffer.allocate(1);
        ch.read(b, end - 1);
        return b.get(0);
    }

    private boolean decodes(String line) {
        try {
            codec.decode(line.trim());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    protected void persist(Event event) {
        persistAll(List.of(event));
    }

    @Override
    protected void persistAll(List<Event> sorted) {
        var lines = new StringBuilder();
        for (var e : sorted) lines.append(codec.encode(e)).append('\n');
        var buf = ByteBuffer.wrap(lines.toString().getBytes(StandardCharsets.UTF_8));

        try (var ch = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ,
                StandardOpenOption.WRITE)) {
            repairTail(ch);
            long position = ch.size();
            while (buf.hasRemaining()) position += ch.write(buf, position);
        } catch (IOException e) {
            throw new EventStoreException("Cannot append to " + file, e);
        }
    }

    @Override
    protected List<Event> loadAll() {
        var byId = new LinkedHashMap<Hlc, Event>();
        for (var e : readRecords()) byId.put(e.id(), e);
        return new ArrayList<>(byId.values());
    }

    @Override
    protected Optional<Event> load(Hlc id) {
        Event found = null;
        for (var e : readRecords()) {
            if (e.id().equals(id)) found = e;
        }
        return Optional.ofNullable(found);
    }

    private List<Event> readRecords() {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new EventStoreException("Cannot read " + file, e);
        }
        int last = lines.size() - 1;
        while (last >= 0 && lines.get(last).isBlank()) last--;

        var out = new ArrayList<Event>(last + 1);
        for (int i = 0; i <= last; i++) {
            var line = lines.get(i).trim();
            if (line.isEmpty()) continue;
            try {
                out.add(codec.decode(line));
            } catch (IllegalArgumentException e) {
                if (i == last) {
                    log.warn("Ignoring unreadable last record of {}: {}", file, e.getMessage());
                } else {
                    throw new EventStoreException("Corrupt record at line " + (i + 1) + " of " + file, e);
                }
            }
        }
        return out;
    }

    @Override
    protected void clear() {
        try {
            Files.write(file, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new EventStoreException("Cannot truncate " + file, e);
        }
    }
}
