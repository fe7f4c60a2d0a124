package org.nowstart.cadence.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Whole-file JSON persistence. A missing or unreadable file loads as the empty value;
 * a failed write surfaces as {@link UncheckedIOException}.
 */
@Slf4j
abstract class JsonFileStore<T> {

    private final ObjectMapper objectMapper;
    private final Path path;
    private final TypeReference<T> type;
    private final Supplier<T> empty;

    protected JsonFileStore(ObjectMapper objectMapper, Path path, TypeReference<T> type, Supplier<T> empty) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.path = path;
        this.type = type;
        this.empty = empty;
    }

    protected T read() {
        if (!Files.exists(path)) {
            return empty.get();
        }
        try {
            T value = objectMapper.readValue(path.toFile(), type);
            return value == null ? empty.get() : value;
        } catch (IOException e) {
            log.warn("Unreadable store file treated as empty. path={}", path, e);
            return empty.get();
        }
    }

    protected void write(T value) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), value);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write store file " + path, e);
        }
    }
}
