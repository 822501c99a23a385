package com.rht.repairorder.source;

import java.nio.file.Path;
import java.util.List;

/**
 * Source of raw event documents.
 */
public interface DocumentStore {

    /**
     * Documents of {@code directory} in processing order.
     * The order is deterministic for an unchanged set of files; merge tie-breaks rely on it.
     *
     * @throws DocumentStoreException if the directory cannot be listed
     */
    List<Path> listDocuments(Path directory);

    /**
     * @throws DocumentStoreException if the document cannot be read
     */
    RawDocument read(Path document);
}
