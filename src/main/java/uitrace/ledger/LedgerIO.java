package uitrace.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.model.CaptureRecord;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes the ledger file: one JSON array of {@link CaptureRecord}s.
 *
 * <p>On read: validates the JSON against {@code ledger-schema.json} before
 * deserializing. On write: pretty-prints the whole array to a sibling temp
 * file, then moves it over the ledger so readers never see a partial file.
 */
public final class LedgerIO {

    private static final Logger log = LoggerFactory.getLogger(LedgerIO.class);
    private static final String SCHEMA_RESOURCE = "/ledger-schema.json";

    private static final TypeReference<List<CaptureRecord>> RECORD_LIST = new TypeReference<>() {};

    /** Shared ObjectMapper; thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private LedgerIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads all records of a ledger file. An empty file reads as an empty list.
     *
     * @throws IOException     if the file cannot be read or parsed
     * @throws LedgerException if the content violates the ledger schema
     */
    public static List<CaptureRecord> read(Path path) throws IOException {
        log.debug("Reading ledger from: {}", path);
        String json = Files.readString(path);
        if (json.isBlank()) return new ArrayList<>();
        JsonNode tree = MAPPER.readTree(json);
        validateSchema(tree, path.toString());
        List<CaptureRecord> records = MAPPER.convertValue(tree, RECORD_LIST);
        return new ArrayList<>(records);
    }

    /**
     * Replaces the ledger file with the given records.
     *
     * @param records the complete ledger content
     * @param path    the ledger file (parent directories are created)
     * @throws IOException if the temp file cannot be written or moved into place
     */
    public static void write(List<CaptureRecord> records, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = parent.resolve(path.getFileName() + ".tmp");
        try {
            MAPPER.writeValue(tmp.toFile(), records);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, falling back to replace", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Wrote {} records to {}", records.size(), path);
    }

    /** Serializes one record to a JSON string. */
    public static String toJson(CaptureRecord record) throws IOException {
        return MAPPER.writeValueAsString(record);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(JsonNode tree, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("ledger-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(tree);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new LedgerException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (LedgerIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = LedgerIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }
}
