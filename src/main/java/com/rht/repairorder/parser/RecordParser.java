package com.rht.repairorder.parser;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.rht.repairorder.entity.IsoTimestampConverter;
import com.rht.repairorder.entity.RepairStatus;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts one event document into a {@link ParsedEvent}.
 *
 * Parsing is all-or-nothing: a root element other than {@code <event>}, bytes that do not decode
 * in the declared charset, or any missing or invalid field rejects the whole document with a
 * {@link ParseError}. No exception escapes {@link #parse(byte[])}.
 */
@Component
public class RecordParser {

    private final XmlMapper xmlMapper = new XmlMapper();

    /**
     * Parse raw file bytes. The charset comes from the XML declaration, UTF-8 when there is none.
     */
    public ParseResult parse(byte[] content) {
        XMLInputFactory inputFactory = xmlMapper.getFactory().getXMLInputFactory();
        try {
            return parse(inputFactory.createXMLStreamReader(new ByteArrayInputStream(content)));
        } catch (XMLStreamException e) {
            return malformed(e.getMessage());
        }
    }

    private ParseResult parse(XMLStreamReader reader) {
        JsonNode event;
        try {
            reader.nextTag();
            String root = reader.getLocalName();
            if (!EventTag.EVENT.getTagName().equals(root)) {
                reader.close();
                return ParseResult.failure(ParseErrorKind.MALFORMED_DOCUMENT,
                    "root element is <" + root + ">, expected <" + EventTag.EVENT + ">");
            }
            try (JsonParser parser = xmlMapper.getFactory().createParser(reader)) {
                event = xmlMapper.readTree(parser);
            }
        } catch (JsonProcessingException e) {
            return malformed(e.getOriginalMessage());
        } catch (XMLStreamException | IOException e) {
            return malformed(e.getMessage());
        }
        if (event == null || !event.isObject() || event.isEmpty()) {
            return ParseResult.failure(ParseErrorKind.MALFORMED_DOCUMENT, "document holds no event element");
        }

        try {
            return ParseResult.success(toEvent(event));
        } catch (InvalidFieldException e) {
            return ParseResult.failure(e.kind, e.getMessage());
        }
    }

    private static ParseResult malformed(String reason) {
        return ParseResult.failure(ParseErrorKind.MALFORMED_DOCUMENT, "not a well-formed document: " + reason);
    }

    private ParsedEvent toEvent(JsonNode event) throws InvalidFieldException {
        int orderId = parseOrderId(requiredText(event, EventTag.ORDER_ID));
        LocalDateTime timestamp = parseTimestamp(requiredText(event, EventTag.DATE_TIME));
        RepairStatus status = parseStatus(requiredText(event, EventTag.STATUS));
        double cost = parseCost(requiredText(event, EventTag.COST));

        JsonNode details = EventTag.REPAIR_DETAILS.in(event);
        if (details == null) {
            throw new InvalidFieldException(ParseErrorKind.MISSING_FIELD, "missing <" + EventTag.REPAIR_DETAILS + ">");
        }
        String technician = text(EventTag.TECHNICIAN.in(details));
        if (technician == null || technician.isEmpty()) {
            throw new InvalidFieldException(ParseErrorKind.MISSING_TECHNICIAN,
                "missing <" + EventTag.TECHNICIAN + "> for order " + orderId);
        }
        List<ParsedPart> parts = parseParts(EventTag.PART.in(EventTag.REPAIR_PARTS.in(details)));

        return new ParsedEvent(orderId, timestamp, status, cost, technician, parts);
    }

    private int parseOrderId(String value) throws InvalidFieldException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidFieldException(ParseErrorKind.INVALID_ORDER_ID, "order id is not an integer: '" + value + "'");
        }
    }

    private LocalDateTime parseTimestamp(String value) throws InvalidFieldException {
        try {
            return LocalDateTime.parse(value, IsoTimestampConverter.FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidFieldException(ParseErrorKind.INVALID_TIMESTAMP,
                "timestamp '" + value + "' does not match YYYY-MM-DDTHH:MM:SS");
        }
    }

    private RepairStatus parseStatus(String value) throws InvalidFieldException {
        return RepairStatus.fromLabel(value)
            .orElseThrow(() -> new InvalidFieldException(ParseErrorKind.UNKNOWN_STATUS, "unknown status '" + value + "'"));
    }

    private double parseCost(String value) throws InvalidFieldException {
        BigDecimal cost;
        try {
            cost = new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new InvalidFieldException(ParseErrorKind.INVALID_COST, "cost is not numeric: '" + value + "'");
        }
        if (cost.signum() < 0) {
            throw new InvalidFieldException(ParseErrorKind.INVALID_COST, "cost is negative: " + value);
        }
        double asDouble = cost.doubleValue();
        if (Double.isInfinite(asDouble)) {
            throw new InvalidFieldException(ParseErrorKind.INVALID_COST, "cost is out of range: " + value);
        }
        return asDouble;
    }

    private List<ParsedPart> parseParts(JsonNode partNode) throws InvalidFieldException {
        if (partNode == null) {
            throw new InvalidFieldException(ParseErrorKind.INVALID_PARTS,
                "no <" + EventTag.PART + "> entries under <" + EventTag.REPAIR_PARTS + ">");
        }
        // A lone <part> reads back as an object, repeated ones as an array.
        List<JsonNode> entries = new ArrayList<>();
        if (partNode.isArray()) {
            partNode.forEach(entries::add);
        } else {
            entries.add(partNode);
        }

        List<ParsedPart> parts = new ArrayList<>(entries.size());
        Set<String> seen = new HashSet<>();
        for (JsonNode entry : entries) {
            String name = text(EventTag.NAME.in(entry));
            if (name == null || name.isEmpty()) {
                throw new InvalidFieldException(ParseErrorKind.INVALID_PARTS, "part without a name attribute");
            }
            if (!seen.add(name)) {
                throw new InvalidFieldException(ParseErrorKind.DUPLICATE_PART, "part '" + name + "' listed twice");
            }
            parts.add(new ParsedPart(name, parseQuantity(name, text(EventTag.QUANTITY.in(entry)))));
        }
        return parts;
    }

    private int parseQuantity(String partName, String value) throws InvalidFieldException {
        int quantity;
        try {
            quantity = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidFieldException(ParseErrorKind.INVALID_QUANTITY,
                "quantity of part '" + partName + "' is not an integer: '" + value + "'");
        }
        if (quantity <= 0) {
            throw new InvalidFieldException(ParseErrorKind.INVALID_QUANTITY,
                "quantity of part '" + partName + "' must be positive: " + quantity);
        }
        return quantity;
    }

    private static String requiredText(JsonNode parent, EventTag tag) throws InvalidFieldException {
        String value = text(tag.in(parent));
        if (value == null || value.isEmpty()) {
            throw new InvalidFieldException(ParseErrorKind.MISSING_FIELD, "missing <" + tag + ">");
        }
        return value;
    }

    /**
     * Trimmed text of a leaf node; null for absent or structured nodes.
     */
    private static String text(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText().trim();
    }

    private static final class InvalidFieldException extends Exception {
        private final ParseErrorKind kind;

        InvalidFieldException(ParseErrorKind kind, String message) {
            super(message);
            this.kind = kind;
        }
    }
}
