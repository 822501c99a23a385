package com.rht.repairorder.batch;

import com.rht.repairorder.source.DocumentStore;
import com.rht.repairorder.source.RawDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemReader;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads the documents of one directory, one per call, in the order given by the {@link DocumentStore}.
 * The directory is listed on the first read.
 */
@Slf4j
public class RawDocumentItemReader implements ItemReader<RawDocument> {

    private final DocumentStore documentStore;
    private final Path directory;

    private List<Path> documents;
    private int next;

    public RawDocumentItemReader(DocumentStore documentStore, Path directory) {
        this.documentStore = documentStore;
        this.directory = directory;
    }

    @Override
    public RawDocument read() {
        if (documents == null) {
            documents = documentStore.listDocuments(directory);
        }
        if (next >= documents.size()) {
            return null;
        }
        Path document = documents.get(next++);
        log.info("({} of {}) reading '{}' ...", next, documents.size(), document);
        return documentStore.read(document);
    }
}
