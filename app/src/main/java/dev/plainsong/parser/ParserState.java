package dev.plainsong.parser;

/**
 * Phases of a song sheet: leading blank lines before the title, header metadata, and the body.
 */
public enum ParserState {
    START,
    DEFINITION,
    BODY
}
