package com.company.forecasting.cache;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.exception.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One file per series key under a local directory. Writes go to a temporary file that is
 * then moved into place, so readers never see a partial model.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "forecasting.model-store.type", havingValue = "filesystem")
public class FileSystemModelBlobStorage implements ModelBlobStorage {

    private static final String EXTENSION = ".model.json";

    private final Path directory;

    @Autowired
    public FileSystemModelBlobStorage(ForecastingProperties properties) {
        this(properties.getModelStore().getDirectory());
    }

    public FileSystemModelBlobStorage(Path directory) {
        this.directory = directory;
    }

    @Override
    public void save(SeriesKey key, byte[] blob) {
        Path target = fileFor(key);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, ".tmp-", EXTENSION);
            Files.write(temp, blob);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote model file {} ({} bytes)", target, blob.length);
        } catch (IOException e) {
            throw new StorageUnavailableException(key, "save", e);
        }
    }

    @Override
    public Optional<byte[]> load(SeriesKey key) {
        try {
            return Optional.of(Files.readAllBytes(fileFor(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageUnavailableException(key, "load", e);
        }
    }

    @Override
    public void delete(SeriesKey key) {
        try {
            if (Files.deleteIfExists(fileFor(key))) {
                log.debug("Deleted model file for {}", key);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException(key, "delete", e);
        }
    }

    Path fileFor(SeriesKey key) {
        return directory.resolve(URLEncoder.encode(key.asStorageId(), StandardCharsets.UTF_8) + EXTENSION);
    }
}
