package dumb.prover.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import dumb.prover.util.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Persistence helpers for extracted command lists.
 */
public final class CommandRecords {

    private static final TypeReference<List<CommandRecord>> LIST = new TypeReference<>() {
    };

    private CommandRecords() {
    }

    public static String toJson(List<CommandRecord> records) {
        return Json.str(records);
    }

    public static List<CommandRecord> fromJson(String json) throws JsonProcessingException {
        return Json.the.readValue(json, LIST);
    }

    public static void write(Path file, List<CommandRecord> records) throws IOException {
        Files.writeString(file, toJson(records));
    }

    public static List<CommandRecord> read(Path file) throws IOException {
        return Json.the.readValue(file.toFile(), LIST);
    }

    /**
     * Every sentence of the records in document order.
     */
    public static List<VernacSentence> sentences(List<CommandRecord> records) {
        var all = new ArrayList<VernacSentence>();
        for (var r : records) all.addAll(r.sentences());
        all.sort(null);
        return all;
    }

    /**
     * Re-emits the sentences as a document. Whitespace and comments are lost, but every sentence starts on the
     * line it came from and spreads its words over the lines it originally spanned.
     */
    public static String toDocumentText(List<CommandRecord> records) {
        var lines = new ArrayList<String>();
        var linenos = new ArrayList<Integer>();
        lines.add("");
        linenos.add(0);
        for (var s : sentences(records)) {
            var loc = s.location();
            while (last(linenos) < loc.lineno()) {
                lines.add("");
                linenos.add(last(linenos) + 1);
            }
            var span = loc.linenoLast() - loc.lineno() + 1;
            var parts = split(s.text().strip().split("\\s+"), span);
            for (var i = 0; i < parts.size(); i++) {
                var lineno = loc.lineno() + i;
                var part = parts.get(i);
                if (lineno == last(linenos)) {
                    var prev = lines.get(lines.size() - 1);
                    if (!part.isEmpty()) lines.set(lines.size() - 1, prev.isEmpty() ? part : prev + " " + part);
                } else {
                    lines.add(part);
                    linenos.add(lineno);
                }
            }
        }
        return String.join("\n", lines);
    }

    private static int last(List<Integer> l) {
        return l.get(l.size() - 1);
    }

    /**
     * Splits words into {@code n} runs of near-equal length, the longer runs first.
     */
    static List<String> split(String[] words, int n) {
        var parts = new ArrayList<String>(n);
        var base = words.length / n;
        var extra = words.length % n;
        var start = 0;
        for (var i = 0; i < n; i++) {
            var end = start + base + (i < extra ? 1 : 0);
            parts.add(String.join(" ", Arrays.asList(words).subList(start, end)));
            start = end;
        }
        return parts;
    }
}
