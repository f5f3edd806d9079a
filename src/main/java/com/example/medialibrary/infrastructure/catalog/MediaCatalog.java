package com.example.medialibrary.infrastructure.catalog;

import com.example.medialibrary.common.exception.CatalogException;
import com.example.medialibrary.domain.model.RawFileRecord;
import java.util.List;

/**
 * Read-only source of raw file records.
 */
public interface MediaCatalog {

    /**
     * @throws CatalogException when the catalog itself cannot be read
     */
    List<RawFileRecord> enumerate();
}
