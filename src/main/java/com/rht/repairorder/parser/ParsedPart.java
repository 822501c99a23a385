package com.rht.repairorder.parser;

public record ParsedPart(String name, int quantity) {
}
