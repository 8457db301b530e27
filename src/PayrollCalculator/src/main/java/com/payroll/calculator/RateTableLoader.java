package com.payroll.calculator;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link RateTable}s from JSON, either bundled on the classpath or from a file supplied by
 * operations when rates change mid-year.
 */
public final class RateTableLoader {

    private static final Logger log = LoggerFactory.getLogger(RateTableLoader.class);

    public static final String STANDARD_RESOURCE = "rate-tables/standard-2024.json";

    private static final ObjectMapper mapper = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private RateTableLoader() {}

    public static RateTable fromClasspath(String resource) {
        ClassLoader loader = RateTableLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new RateTableException("Rate table resource not found: " + resource);
            }
            RateTable table = read(in, resource);
            log.debug("Loaded rate table {} from classpath:{}", table.getVersion(), resource);
            return table;
        } catch (IOException e) {
            throw new RateTableException("Failed to read rate table resource " + resource, e);
        }
    }

    public static RateTable fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            RateTable table = read(in, path.toString());
            log.debug("Loaded rate table {} from {}", table.getVersion(), path);
            return table;
        } catch (IOException e) {
            throw new RateTableException("Failed to read rate table file " + path, e);
        }
    }

    /**
     * The file at {@code path} when one is given, the bundled 2024 table otherwise.
     */
    public static RateTable fromPathOrStandard(String path) {
        if (path == null || path.isBlank()) {
            return fromClasspath(STANDARD_RESOURCE);
        }
        return fromFile(Path.of(path));
    }

    private static RateTable read(InputStream in, String source) throws IOException {
        try {
            return mapper.readValue(in, RateTable.class);
        } catch (IOException e) {
            // Validation failures inside the creators arrive wrapped by Jackson
            Throwable cause = e.getCause();
            if (cause instanceof RateTableException) {
                throw new RateTableException("Invalid rate table " + source + ": " + cause.getMessage(), cause);
            }
            throw e;
        }
    }
}
