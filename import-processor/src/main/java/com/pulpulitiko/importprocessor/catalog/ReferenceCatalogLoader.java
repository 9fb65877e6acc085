package com.pulpulitiko.importprocessor.catalog;

/**
 * Builds a fresh {@link ReferenceCatalog} snapshot. Called once per import run.
 */
public interface ReferenceCatalogLoader {

    /**
     * @throws ReferenceDataException when positions or parties cannot be fetched
     */
    ReferenceCatalog loadCatalog();
}
