package org.topomap.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.topomap.geometry.Vec2;
import org.topomap.topology.Link;
import org.topomap.topology.Topology;
import org.topomap.topology.TopologyCodec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main")
class MainTest {

    private static final String INPUT = """
            {
              "nodes": [
                {"id": "A", "pos": [0, 0]},
                {"id": "B", "pos": [4, 0]}
              ],
              "links": [
                {"from": "A", "to": "B"}
              ]
            }
            """;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return Main.run(
                args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                out,
                new PrintStream(err, true, StandardCharsets.UTF_8)
        );
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("1. Pipeline")
    class PipelineTests {

        @Test
        @DisplayName("Routes links and places labels from stdin to stdout")
        void testStdio() {
            assertEquals(Main.EXIT_OK, run(INPUT), stderr());

            Topology result = TopologyCodec.decode(out.toString(StandardCharsets.UTF_8));
            Link link = result.getLink("A-B");
            assertTrue(link.isRouted());
            assertEquals(new Vec2(0, 0), link.getRoute().first());
            assertEquals(new Vec2(4, 0), link.getRoute().last());
            assertTrue(result.getNode("A").hasLabelAt());
            assertTrue(result.getNode("B").hasLabelAt());
        }

        @Test
        @DisplayName("Reads and writes files")
        void testFiles(@TempDir Path dir) throws IOException {
            Path input = dir.resolve("in.json");
            Path output = dir.resolve("out.json");
            Files.writeString(input, INPUT, StandardCharsets.UTF_8);

            assertEquals(Main.EXIT_OK, run("", "--orthogonal", "--margin", "2", input.toString(), output.toString()), stderr());

            Topology result = TopologyCodec.decode(Files.readString(output, StandardCharsets.UTF_8));
            assertTrue(result.getLink("A-B").isRouted());
            assertEquals(0, out.size(), "Nothing should go to stdout");
        }

        @Test
        @DisplayName("Zero margin keeps the automatic extents")
        void testZeroMargin() {
            assertEquals(Main.EXIT_OK, run(INPUT, "--margin", "0", "-", "-"), stderr());
            Topology result = TopologyCodec.decode(out.toString(StandardCharsets.UTF_8));
            assertTrue(result.getLink("A-B").isRouted());
        }
    }

    @Nested
    @DisplayName("2. Failures")
    class FailureTests {

        @Test
        @DisplayName("Bad options exit with the usage code")
        void testUsage() {
            assertEquals(Main.EXIT_USAGE, run(INPUT, "--bogus"));
            assertTrue(stderr().contains("usage:"));
            assertEquals(Main.EXIT_USAGE, run(INPUT, "--margin"));
            assertEquals(Main.EXIT_USAGE, run(INPUT, "--margin", "-1"));
            assertEquals(Main.EXIT_USAGE, run(INPUT, "--margin", "wide"));
            assertEquals(Main.EXIT_USAGE, run(INPUT, "a.json", "b.json", "c.json"));
        }

        @Test
        @DisplayName("Malformed input exits with the input-error code")
        void testMalformedInput() {
            assertEquals(Main.EXIT_INPUT_ERROR, run("{\"nodes\": ["));
            assertTrue(stderr().contains("TOPOLOGY_MALFORMED_JSON"), stderr());
        }

        @Test
        @DisplayName("Missing input file exits with the input-error code")
        void testMissingFile(@TempDir Path dir) {
            assertEquals(Main.EXIT_INPUT_ERROR, run("", dir.resolve("absent.json").toString()));
        }
    }

    @Test
    @DisplayName("Options parse flags and positional files")
    void testOptions() {
        Main.Options options = Main.Options.parse(new String[]{"--no-spread-links", "--no-avoid-nodes", "in.json"});
        assertFalse(options.config().isSpreadLinks());
        assertFalse(options.config().isAvoidNodes());
        assertFalse(options.config().isOrthogonal());
        assertEquals(1, options.margin());
        assertEquals("in.json", options.input());
        assertNull(options.output());
    }
}
