package io.timeline.store;

import io.timeline.core.Event;
import io.timeline.core.Hlc;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static io.timeline.store.Events.inc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonLinesEventStoreTest {

    @TempDir
    Path dir;

    private Path file;
    private JsonLinesEventStore store;

    @BeforeEach
    void setUp() {
        file = dir.resolve("events.jsonl");
        store = new JsonLinesEventStore(file, EventProcessor.NONE);
    }

    @AfterEach
    void tearDown() {
        store.dispose();
    }

    private JsonLinesEventStore reopen() {
        return new JsonLinesEventStore(file, EventProcessor.NONE);
    }

    private static String line(String id) {
        return "{\"id\":\"" + id + "\",\"type\":\"Increment\",\"data\":{\"amount\":1},\"schemaVersion\":\"1.0.0\"}";
    }

    @Test
    void addSurvivesReopen() {
        var e = new Event(new Hlc(100, 0, "node1"), "created", Map.of("foo", "bar"), "2.0.0");
        store.add(e);

        try (var loaded = reopen()) {
            assertThat(loaded.getAll()).containsExactly(e);
        }
    }

    @Test
    void writesOneRecordPerLine() throws IOException {
        store.addAll(List.of(inc(200), inc(100)));

        var lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("{\"id\":\"100:0:A\"");
        assertThat(lines.get(1)).startsWith("{\"id\":\"200:0:A\"");
    }

    @Test
    void getByIdAfterReopen() {
        var a = Events.of(100, "a");
        var b = Events.of(200, "b");
        store.addAll(List.of(a, b));

        try (var loaded = reopen()) {
            assertThat(loaded.getById(b.id().format())).hasValueSatisfying(e -> assertThat(e.type()).isEqualTo("b"));
            assertThat(loaded.getById(new Hlc(5, 0, "A"))).isEmpty();
        }
    }

    @Test
    void deleteAllEmptiesFile() throws IOException {
        store.add(inc(1));
        store.deleteAll();

        assertThat(Files.size(file)).isZero();
        try (var loaded = reopen()) {
            assertThat(loaded.getAll()).isEmpty();
        }
    }

    @Test
    void skipsBlankLines() throws IOException {
        Files.writeString(file, "\n" + line("1:0:A") + "\n   \n\n" + line("2:0:A") + "\n\n");

        try (var loaded = reopen()) {
            assertThat(loaded.getAll()).extracting(e -> e.id().format()).containsExactly("1:0:A", "2:0:A");
        }
    }

    @Test
    void tornTailIsTruncatedOnOpen() throws IOException {
        Files.writeString(file, line("1:0:A") + "\n" + "{\"id\":\"2:0:A\",\"ty");

        try (var loaded = reopen()) {
            assertThat(Files.readString(file)).isEqualTo(line("1:0:A") + "\n");
            loaded.add(inc(3));
            assertThat(loaded.getAll()).extracting(e -> e.id().format()).containsExactly("1:0:A", "3:0:A");
        }
    }

    @Test
    void tornTailWrittenWhileOpenIsRepairedBeforeNextAppend() throws IOException {
        store.add(inc(1));
        Files.writeString(file, "{\"id\":\"2:0:A\",\"ty", StandardOpenOption.APPEND);

        store.add(inc(3));

        assertThat(store.getAll()).containsExactly(inc(1), inc(3));
        assertThat(Files.readString(file)).isEqualTo(line("1:0:A") + "\n" + line("3:0:A") + "\n");
    }

    @Test
    void completeUnterminatedTailWrittenWhileOpenIsKeptOnAppend() throws IOException {
        store.add(inc(1));
        Files.writeString(file, line("2:0:A"), StandardOpenOption.APPEND);

        store.add(inc(3));

        assertThat(store.getAll()).extracting(e -> e.id().format()).containsExactly("1:0:A", "2:0:A", "3:0:A");
    }

    @Test
    void completeButUnterminatedTailIsKept() throws IOException {
        Files.writeString(file, line("1:0:A") + "\n" + line("2:0:A"));

        try (var loaded = reopen()) {
            loaded.add(inc(3));
            assertThat(loaded.getAll()).extracting(e -> e.id().format()).containsExactly("1:0:A", "2:0:A", "3:0:A");
        }
    }

    @Test
    void unreadableLastRecordIsTreatedAsAbsent() throws IOException {
        store.add(inc(1));
        Files.writeString(file, "{not json}\n", StandardOpenOption.APPEND);

        assertThat(store.getAll()).containsExactly(inc(1));
    }

    @Test
    void corruptRecordBeforeTheEndFails() throws IOException {
        Files.writeString(file, line("1:0:A") + "\n{garbage\n" + line("2:0:A") + "\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> store.getAll())
                .isInstanceOf(EventStoreException.class)
                .hasMessageContaining("line 2");
    }

    @Test
    void repeatedIdKeepsLastRecordAtFirstPosition() {
        var first = inc(100);
        var other = inc(200);
        var replacement = new Event(first.id(), "Increment", Map.of("amount", 7));

        store.add(first);
        store.add(other);
        store.add(replacement);

        assertThat(store.getAll()).containsExactly(replacement, other);
        assertThat(store.getById(first.id())).contains(replacement);
    }

    @Test
    void createsMissingParentDirectories() {
        var nested = dir.resolve("a/b/events.jsonl");
        try (var s = new JsonLinesEventStore(nested, EventProcessor.NONE)) {
            s.add(inc(1));
            assertThat(Files.exists(nested)).isTrue();
        }
    }

    @Test
    void restoreRewritesFile() throws IOException {
        var e1 = inc(100);
        var e2 = inc(200);
        store.addAll(List.of(e1, e2, inc(300)));

        assertThat(store.restoreToEvent(e2)).isTrue();

        assertThat(Files.readAllLines(file)).hasSize(2);
        try (var loaded = reopen()) {
            assertThat(loaded.getAll()).containsExactly(e1, e2);
        }
    }
}
