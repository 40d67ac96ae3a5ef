package com.di.bqtarget.ingest;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Append-only newline-delimited JSON file holding one table's records until the end-of-stream load.
 * Owned by exactly one {@link TableEntry}.
 */
@Slf4j
public class RecordSpool implements AutoCloseable {

    @Getter
    private final Path file;
    private BufferedWriter writer;
    @Getter
    private long lineCount;

    RecordSpool(Path file) {
        this.file = file;
        try {
            this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open spool " + file, e);
        }
    }

    public static RecordSpool create(String tableName) {
        try {
            Path file = Files.createTempFile("bqtarget-" + tableName + "-", ".jsonl");
            log.debug("[SPOOL] {} -> {}", tableName, file);
            return new RecordSpool(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create spool file for " + tableName, e);
        }
    }

    public void append(String line) {
        if (writer == null) {
            throw new IllegalStateException("Spool " + file + " is already sealed");
        }
        try {
            writer.write(line);
            writer.write('\n');
            lineCount++;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write to spool " + file, e);
        }
    }

    /** Flushes and closes the writer; the file stays readable until {@link #close()}. */
    public Path seal() {
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot flush spool " + file, e);
            } finally {
                writer = null;
            }
        }
        return file;
    }

    /** Seals the spool and deletes its file. */
    @Override
    public void close() {
        try {
            seal();
        } finally {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("[SPOOL] could not delete {}: {}", file, e.getMessage());
            }
        }
    }
}
