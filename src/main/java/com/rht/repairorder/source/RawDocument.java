package com.rht.repairorder.source;

/**
 * Bytes of one input file, with the file name it came from.
 * The bytes are left undecoded; the XML parser picks the charset from the document's own declaration.
 */
public record RawDocument(String name, byte[] content) {
}
