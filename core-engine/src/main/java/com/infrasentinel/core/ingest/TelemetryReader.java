package com.infrasentinel.core.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infrasentinel.core.model.RecordFormatException;
import com.infrasentinel.core.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads telemetry records from JSON.
 *
 * <p>
 * A dataset is a JSON array of record objects, each converted with
 * {@link RecordParser}. Datasets are returned sorted by timestamp (records
 * sharing a timestamp keep their file order), which is the order the detector
 * requires.
 * </p>
 *
 * @since 1.0.0
 */
public final class TelemetryReader {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryReader.class);

    private static final TypeReference<List<LinkedHashMap<String, Object>>> DATASET =
            new TypeReference<>() {
            };
    private static final TypeReference<LinkedHashMap<String, Object>> RECORD =
            new TypeReference<>() {
            };

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private TelemetryReader() {
        // utility class; not instantiable
    }

    /**
     * @param path path to a JSON array of records; must not be {@code null}
     * @return records sorted by timestamp
     * @throws IllegalArgumentException if the file does not exist
     * @throws RecordFormatException    if the content is not a valid dataset
     * @throws UncheckedIOException     if reading fails
     */
    public static List<TelemetryRecord> fromFile(String path) {
        Objects.requireNonNull(path, "Dataset path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            List<TelemetryRecord> records = read(is);
            LOG.info("Read {} record(s) from {}", records.size(), path);
            return records;
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Dataset file not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource holding a JSON array of records
     * @return records sorted by timestamp
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static List<TelemetryRecord> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = TelemetryReader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return read(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @param is stream holding a JSON array of records; not closed
     * @return records sorted by timestamp
     * @throws IOException           if reading fails
     * @throws RecordFormatException if the content is not a valid dataset
     */
    public static List<TelemetryRecord> read(InputStream is) throws IOException {
        List<LinkedHashMap<String, Object>> raw;
        try {
            raw = MAPPER.readValue(is, DATASET);
        } catch (JsonProcessingException e) {
            throw new RecordFormatException("Malformed dataset: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            return List.of();
        }

        List<TelemetryRecord> records = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            Map<String, Object> fields = raw.get(i);
            if (fields == null) {
                throw new RecordFormatException("Record at index " + i + " is null");
            }
            try {
                records.add(RecordParser.parse(fields));
            } catch (RecordFormatException e) {
                throw new RecordFormatException("Record at index " + i + ": " + e.getMessage(), e);
            }
        }
        records.sort(Comparator.comparing(TelemetryRecord::getTimestamp));
        return records;
    }

    /**
     * Parse a single JSON record object.
     *
     * @param json UTF-8 JSON bytes; must not be {@code null}
     * @return the typed record
     * @throws RecordFormatException if the bytes are not a valid record
     */
    public static TelemetryRecord readRecord(byte[] json) {
        Objects.requireNonNull(json, "JSON bytes must not be null");
        Map<String, Object> fields;
        try {
            fields = MAPPER.readValue(json, RECORD);
        } catch (IOException e) {
            throw new RecordFormatException("Malformed record: " + e.getMessage(), e);
        }
        if (fields == null) {
            throw new RecordFormatException("Record is JSON null");
        }
        return RecordParser.parse(fields);
    }
}
