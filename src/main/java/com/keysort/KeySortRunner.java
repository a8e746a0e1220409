package com.keysort;

import com.keysort.sort.KeybindingSorter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads one document, sorts it and writes the result.
 * <p>
 * The input is the {@code keysort.input} file, else the first non-option argument,
 * else standard input. Output always goes to the given stream, UTF-8 encoded.
 */
public class KeySortRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(KeySortRunner.class);

    private static final String STDIN = "-";

    private final KeybindingSorter sorter;
    private final String configuredInput;
    private final InputStream stdin;
    private final OutputStream stdout;

    public KeySortRunner(KeybindingSorter sorter, String configuredInput, InputStream stdin, OutputStream stdout) {
        this.sorter = sorter;
        this.configuredInput = configuredInput;
        this.stdin = stdin;
        this.stdout = stdout;
    }

    @Override
    public void run(String... args) {
        String input = resolveInput(configuredInput, args);
        String text = read(input);
        String sorted = sorter.sort(text);
        write(sorted);
    }

    static String resolveInput(String configured, String... args) {
        if (configured != null && !configured.isBlank()) {
            return configured.strip();
        }
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return arg;
            }
        }
        return STDIN;
    }

    private String read(String input) {
        try {
            if (STDIN.equals(input)) {
                log.debug("Reading document from standard input");
                return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            }
            log.debug("Reading document from: {}", input);
            return Files.readString(Path.of(input), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input: " + input, e);
        }
    }

    private void write(String text) {
        try {
            stdout.write(text.getBytes(StandardCharsets.UTF_8));
            stdout.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output", e);
        }
    }
}
