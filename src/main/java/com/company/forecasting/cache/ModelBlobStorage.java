package com.company.forecasting.cache;

import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.exception.StorageUnavailableException;

import java.util.Optional;

/**
 * Raw byte storage for serialized models, one blob per series key.
 * Every I/O failure is reported as {@link StorageUnavailableException}.
 */
public interface ModelBlobStorage {

    void save(SeriesKey key, byte[] blob);

    Optional<byte[]> load(SeriesKey key);

    void delete(SeriesKey key);
}
