package com.rht.repairorder.batch;

import com.rht.repairorder.parser.ParseResult;
import com.rht.repairorder.parser.ParsedEvent;
import com.rht.repairorder.parser.RecordParser;
import com.rht.repairorder.source.RawDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.stereotype.Component;

/**
 * Parses each document's raw bytes; rejected documents are logged and filtered out of the chunk.
 */
@Slf4j
@Component
public class ParsingItemProcessor implements ItemProcessor<RawDocument, ParsedEvent> {

    private final RecordParser recordParser;

    public ParsingItemProcessor(RecordParser recordParser) {
        this.recordParser = recordParser;
    }

    @Override
    public ParsedEvent process(RawDocument document) {
        ParseResult result = recordParser.parse(document.content());
        result.getError().ifPresent(error ->
            log.error("Skipping '{}' because of: {}", document.name(), error));
        return result.getEvent().orElse(null);
    }
}
