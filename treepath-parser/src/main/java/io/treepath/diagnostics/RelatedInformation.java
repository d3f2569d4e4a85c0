package io.treepath.diagnostics;

import io.treepath.lexer.Range;

/**
 * A secondary source location attached to a diagnostic, e.g. the opening delimiter of an unclosed
 * group.
 */
public record RelatedInformation(Range range, String message) {}
