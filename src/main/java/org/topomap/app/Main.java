package org.topomap.app;

import lombok.extern.log4j.Log4j2;
import org.topomap.labels.LabelPlacer;
import org.topomap.routing.core.GridExtents;
import org.topomap.routing.core.LinkRouter;
import org.topomap.routing.core.LinkRouterConfig;
import org.topomap.routing.core.RoutingReport;
import org.topomap.topology.Topology;
import org.topomap.topology.TopologyCodec;
import org.topomap.topology.TopologyFormatException;

import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point: reads a topology, routes its links, places its labels and writes
 * the result.
 *
 * <pre>
 * topomap [--no-spread-links] [--orthogonal] [--no-avoid-nodes] [--margin N] [input.json|-] [output.json|-]
 * </pre>
 *
 * <p>Missing or {@code -} file arguments mean standard input and output.</p>
 */
@Log4j2
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "usage: topomap [--no-spread-links] [--orthogonal] [--no-avoid-nodes] [--margin N]"
                    + " [input.json|-] [output.json|-]";

    /**
     * Runs the pipeline and exits with its status code.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Runs the pipeline against explicit streams.
     *
     * @return process exit code.
     */
    static int run(String[] args, InputStream stdin, OutputStream stdout, PrintStream stderr) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            stderr.println(ex.getMessage());
            stderr.println(USAGE);
            return EXIT_USAGE;
        }

        Topology topology;
        try (Reader reader = openInput(options.input(), stdin)) {
            topology = TopologyCodec.decode(reader);
        } catch (IOException | TopologyFormatException ex) {
            log.error("cannot read topology from {}", options.input(), ex);
            stderr.println("error: " + ex.getMessage());
            return EXIT_INPUT_ERROR;
        }

        LinkRouter router = new LinkRouter(topology, options.config());
        if (options.margin() > 0) {
            GridExtents grown = router.getExtents().grow(options.margin());
            router.setExtents(grown.min().x(), grown.min().y(), grown.max().x(), grown.max().y());
        }
        RoutingReport report = router.routeLinks();
        new LabelPlacer(topology).placeLabels();
        if (!report.isComplete()) {
            stderr.println("warning: unrouted links " + report.getUnroutedLinkIds());
        }

        try (Writer writer = openOutput(options.output(), stdout)) {
            TopologyCodec.encode(topology, writer);
            writer.write(System.lineSeparator());
        } catch (IOException ex) {
            log.error("cannot write topology to {}", options.output(), ex);
            stderr.println("error: " + ex.getMessage());
            return EXIT_INPUT_ERROR;
        }
        return EXIT_OK;
    }

    private static Reader openInput(String input, InputStream stdin) throws IOException {
        if (input == null || "-".equals(input)) {
            // the caller owns stdin; closing the reader must not close it
            return new InputStreamReader(new NonClosingInputStream(stdin), StandardCharsets.UTF_8);
        }
        return Files.newBufferedReader(Path.of(input), StandardCharsets.UTF_8);
    }

    private static Writer openOutput(String output, OutputStream stdout) throws IOException {
        if (output == null || "-".equals(output)) {
            return new OutputStreamWriter(new NonClosingOutputStream(stdout), StandardCharsets.UTF_8);
        }
        return Files.newBufferedWriter(Path.of(output), StandardCharsets.UTF_8);
    }

    /**
     * Parsed command line.
     */
    record Options(LinkRouterConfig config, int margin, String input, String output) {

        static Options parse(String[] args) {
            LinkRouterConfig.LinkRouterConfigBuilder config = LinkRouterConfig.builder();
            int margin = 1;
            String input = null;
            String output = null;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--no-spread-links" -> config.spreadLinks(false);
                    case "--orthogonal" -> config.orthogonal(true);
                    case "--no-avoid-nodes" -> config.avoidNodes(false);
                    case "--margin" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--margin needs a value");
                        }
                        margin = parseMargin(args[++i]);
                    }
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("unknown option " + arg);
                        }
                        if (input == null) {
                            input = arg;
                        } else if (output == null) {
                            output = arg;
                        } else {
                            throw new IllegalArgumentException("unexpected argument " + arg);
                        }
                    }
                }
            }
            return new Options(config.build(), margin, input, output);
        }

        private static int parseMargin(String value) {
            int margin;
            try {
                margin = Integer.parseInt(value);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("--margin must be an integer: " + value, ex);
            }
            if (margin < 0) {
                throw new IllegalArgumentException("--margin must be >= 0: " + value);
            }
            return margin;
        }
    }

    private static final class NonClosingInputStream extends FilterInputStream {
        NonClosingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() {
            // stream belongs to the caller
        }
    }

    private static final class NonClosingOutputStream extends FilterOutputStream {
        NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
