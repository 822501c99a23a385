package com.rht.repairorder.parser;

public record ParseError(ParseErrorKind kind, String message) {

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
