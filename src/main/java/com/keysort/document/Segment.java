package com.keysort.document;

/**
 * One rule object of the array body with the text around it, byte for byte.
 *
 * @param leading  Whitespace and comments between the previous rule and this one
 * @param object   Exact source span of the object, braces included
 * @param trailing Commas, spaces and comments following the object on its line
 */
public record Segment(String leading, String object, String trailing) {
}
