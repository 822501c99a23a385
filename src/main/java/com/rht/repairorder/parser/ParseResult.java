package com.rht.repairorder.parser;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing one document: either a {@link ParsedEvent} or a {@link ParseError}, never both.
 */
public final class ParseResult {

    private final ParsedEvent event;
    private final ParseError error;

    private ParseResult(ParsedEvent event, ParseError error) {
        this.event = event;
        this.error = error;
    }

    public static ParseResult success(ParsedEvent event) {
        return new ParseResult(Objects.requireNonNull(event, "event"), null);
    }

    public static ParseResult failure(ParseErrorKind kind, String message) {
        return new ParseResult(null, new ParseError(kind, message));
    }

    public boolean isSuccess() {
        return event != null;
    }

    public Optional<ParsedEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<ParseError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult{event=" + event + "}" : "ParseResult{error=" + error + "}";
    }
}
