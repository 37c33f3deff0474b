package com.routergen.core.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.core.example.Example;
import com.routergen.core.example.ExampleCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * JSONL sink: one record line per example, plus an optional formatted file
 * with {"text": rendered} lines.
 *
 * Both lines of an example are serialized before the lock is taken, then
 * appended together under it. If either append fails, both files are cut back
 * to their size before the example, so a write lands completely or not at all.
 * Files are truncated on open.
 */
public class JsonlDatasetSink implements DatasetSink {

    private static final Logger log = LoggerFactory.getLogger(JsonlDatasetSink.class);

    private final ExampleCodec   codec;
    private final ObjectMapper   objectMapper;
    private final Path           recordsPath;
    private final LineFile       records;
    private final LineFile       formatted;
    private final Object         writeLock = new Object();

    private long written;

    JsonlDatasetSink(ExampleCodec codec, ObjectMapper objectMapper, Path recordsPath,
                     LineFile records, LineFile formatted) {
        this.codec        = codec;
        this.objectMapper = objectMapper;
        this.recordsPath  = recordsPath;
        this.records      = records;
        this.formatted    = formatted;
    }

    /**
     * @param formattedPath may be null to skip the formatted file
     */
    public static JsonlDatasetSink open(Path recordsPath, Path formattedPath,
                                        ExampleCodec codec, ObjectMapper objectMapper) {
        LineFile records = null;
        try {
            records = LineFile.open(recordsPath);
            LineFile formatted = formattedPath == null ? null : LineFile.open(formattedPath);
            log.info("[Sink] Writing records to {}{}", recordsPath,
                    formattedPath == null ? "" : " and formatted text to " + formattedPath);
            return new JsonlDatasetSink(codec, objectMapper, recordsPath, records, formatted);
        } catch (IOException e) {
            closeQuietly(records);
            throw new DatasetIOException("Cannot open dataset output " + recordsPath, e);
        }
    }

    @Override
    public void write(Example example, String rendered) {
        String recordLine = codec.toLine(example);
        String textLine = formatted == null ? null : objectMapper.valueToTree(Map.of("text", rendered)).toString();

        synchronized (writeLock) {
            long recordsMark;
            long formattedMark;
            try {
                recordsMark   = records.size();
                formattedMark = formatted == null ? 0 : formatted.size();
            } catch (IOException e) {
                throw new DatasetIOException("Cannot read size of " + recordsPath, e);
            }

            try {
                records.append(recordLine);
                if (textLine != null) {
                    formatted.append(textLine);
                }
                written++;
            } catch (IOException e) {
                DatasetIOException failure = new DatasetIOException("Failed to append to " + recordsPath, e);
                rollback(recordsMark, formattedMark, failure);
                throw failure;
            }
        }
    }

    private void rollback(long recordsMark, long formattedMark, DatasetIOException failure) {
        try {
            records.truncate(recordsMark);
            if (formatted != null) {
                formatted.truncate(formattedMark);
            }
            log.warn("[Sink] Rolled back partial write to {}", recordsPath);
        } catch (IOException e) {
            failure.addSuppressed(e);
            log.error("[Sink] Rollback of {} failed; output may hold a partial example", recordsPath, e);
        }
    }

    @Override
    public long written() {
        synchronized (writeLock) {
            return written;
        }
    }

    @Override
    public void close() {
        synchronized (writeLock) {
            try {
                records.close();
                if (formatted != null) formatted.close();
            } catch (IOException e) {
                throw new DatasetIOException("Failed to close " + recordsPath, e);
            }
        }
        log.info("[Sink] Closed {} after {} record(s)", recordsPath, written);
    }

    private static void closeQuietly(LineFile writer) {
        if (writer == null) return;
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("[Sink] Failed to close writer after open error: {}", e.getMessage());
        }
    }
}
