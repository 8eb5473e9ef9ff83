package com.bondtrader.connector;

import com.bondtrader.exception.RecordSinkException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only text sink: one line per published value, {@code epochMillis,field,...}.
 *
 * <p>The file is truncated when the connector is created, so each run starts from an
 * empty file. Writes are unbuffered; a record is on disk when {@link #publish} returns.
 *
 * @param <V> published value type
 */
public class FileRecordConnector<V> implements RecordConnector<V> {

    private static final Logger log = LoggerFactory.getLogger(FileRecordConnector.class);

    private final Path file;
    private final Clock clock;
    private final Function<V, List<String>> formatter;
    private long recordCount;

    public FileRecordConnector(Path file, Clock clock, Function<V, List<String>> formatter) {
        this.file = file;
        this.clock = clock;
        this.formatter = formatter;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RecordSinkException("Failed to create record file " + file, e);
        }
        log.debug("Record sink ready: {}", file);
    }

    @Override
    public void publish(V data) {
        String line = clock.millis() + "," + String.join(",", formatter.apply(data)) + System.lineSeparator();
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new RecordSinkException("Failed to append to " + file, e);
        }
        recordCount++;
    }

    public Path getFile() {
        return file;
    }

    public long getRecordCount() {
        return recordCount;
    }
}
