package uitrace.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.model.CaptureRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only, single-writer store of {@link CaptureRecord}s backed by one
 * JSON array file.
 *
 * <p>Record {@code i} always has {@code sequenceId == i}, so the next id is
 * simply {@link #size()}. Each append rewrites the whole file; if the write
 * fails the in-memory list is rolled back and the file is left as it was.
 *
 * <p>Records are copied on the way in and on the way out; a committed entry
 * cannot be changed through a reference held by a caller.
 */
public class Ledger {

    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    public static final String FILE_NAME = "collected_data.json";

    private final Path file;
    private final List<CaptureRecord> records;

    private Ledger(Path file, List<CaptureRecord> records) {
        this.file = file;
        this.records = records;
    }

    /**
     * Opens the ledger at {@code file}, creating an empty one if it is missing.
     *
     * @param reset truncate an existing ledger to {@code []}
     * @throws LedgerException if the file cannot be read, fails schema
     *                         validation, or breaks the sequence invariant
     */
    public static Ledger open(Path file, boolean reset) {
        try {
            if (reset || !Files.exists(file)) {
                LedgerIO.write(new ArrayList<>(), file);
                log.info("Initialised empty ledger at {}", file);
                return new Ledger(file, new ArrayList<>());
            }
            List<CaptureRecord> loaded = LedgerIO.read(file);
            for (int i = 0; i < loaded.size(); i++) {
                int id = loaded.get(i).getSequenceId();
                if (id != i) {
                    throw new LedgerException(String.format(
                            "Ledger %s is out of sequence: record %d has sequenceId %d", file, i, id));
                }
            }
            log.info("Opened ledger {} with {} records", file, loaded.size());
            return new Ledger(file, loaded);
        } catch (IOException e) {
            throw new LedgerException("Cannot open ledger " + file + ": " + e.getMessage(), e);
        }
    }

    /** Opens {@value #FILE_NAME} inside {@code outputDir}. */
    public static Ledger openIn(Path outputDir, boolean reset) {
        return open(outputDir.resolve(FILE_NAME), reset);
    }

    /** Number of records; also the sequence id the next record must carry. */
    public synchronized int size() {
        return records.size();
    }

    /**
     * Appends a record and persists the ledger.
     *
     * @throws LedgerException if the record's id is not the next id, or the
     *                         file could not be rewritten
     */
    public synchronized void append(CaptureRecord record) {
        if (record.getSequenceId() != records.size()) {
            throw new LedgerException(String.format(
                    "Expected sequenceId %d but record has %d", records.size(), record.getSequenceId()));
        }
        records.add(record.copy());
        try {
            LedgerIO.write(records, file);
        } catch (IOException e) {
            records.remove(records.size() - 1);
            throw new LedgerException("Failed to write ledger " + file + ": " + e.getMessage(), e);
        }
        log.debug("Appended record {} to {}", record.getSequenceId(), file);
    }

    /** Truncates the ledger to an empty array. */
    public synchronized void reset() {
        try {
            LedgerIO.write(new ArrayList<>(), file);
        } catch (IOException e) {
            throw new LedgerException("Failed to reset ledger " + file + ": " + e.getMessage(), e);
        }
        records.clear();
        log.info("Ledger {} reset", file);
    }

    /** Read-only snapshot of the records; each element is a copy. */
    public synchronized List<CaptureRecord> records() {
        List<CaptureRecord> copies = new ArrayList<>(records.size());
        for (CaptureRecord r : records) copies.add(r.copy());
        return Collections.unmodifiableList(copies);
    }

    public Path getFile() { return file; }
}
