package com.rht.repairorder.parser;

/**
 * Reasons a document is rejected by {@link RecordParser}.
 */
public enum ParseErrorKind {
    MALFORMED_DOCUMENT,
    MISSING_FIELD,
    INVALID_ORDER_ID,
    INVALID_TIMESTAMP,
    UNKNOWN_STATUS,
    INVALID_COST,
    MISSING_TECHNICIAN,
    INVALID_PARTS,
    INVALID_QUANTITY,
    DUPLICATE_PART
}
