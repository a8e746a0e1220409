package com.keysort;

import com.keysort.adapter.spring.KeySortProperties;
import com.keysort.exception.ConfigurationException;
import com.keysort.exception.DocumentStructureException;
import com.keysort.sort.KeybindingSorter;
import com.keysort.spring.EnableKeySort;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.UncheckedIOException;

/**
 * Command-line entry point: sorts a binding document from a file or standard input
 * to standard output.
 * <p>
 * Exit codes: 0 success, 1 configuration error, 2 structural or I/O failure.
 */
@SpringBootApplication
@EnableKeySort
public class KeySortApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(KeySortApplication.class, args)));
    }

    @Bean
    public CommandLineRunner keySortRunner(KeybindingSorter sorter, KeySortProperties properties) {
        return new KeySortRunner(sorter, properties.getInput(), System.in, System.out);
    }

    @Bean
    public ExitCodeExceptionMapper keySortExitCodes() {
        return KeySortApplication::exitCode;
    }

    /**
     * Exit code for a failure, looking through wrapping exceptions.
     */
    static int exitCode(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ConfigurationException) {
                return 1;
            }
            if (t instanceof DocumentStructureException || t instanceof UncheckedIOException) {
                return 2;
            }
        }
        return 1;
    }
}
