package com.rht.repairorder.source;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads {@code *.xml} files of a directory in ascending file-name order. Other files and subdirectories are ignored.
 */
@Slf4j
@Component
public class DirectoryDocumentStore implements DocumentStore {

    static final String EXTENSION = ".xml";

    @Override
    public List<Path> listDocuments(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new DocumentStoreException("Data directory '" + directory + "' does not exist or is not a directory");
        }
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> documents = entries
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
            log.info("Reading from folder '{}': {} document(s) ...", directory, documents.size());
            return documents;
        } catch (IOException e) {
            throw new DocumentStoreException("Cannot list data directory '" + directory + "'", e);
        }
    }

    @Override
    public RawDocument read(Path document) {
        try {
            return new RawDocument(document.getFileName().toString(), Files.readAllBytes(document));
        } catch (IOException e) {
            throw new DocumentStoreException("Cannot read document '" + document + "'", e);
        }
    }
}
