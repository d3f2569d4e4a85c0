package io.treepath.lexer;

/**
 * A location in expression source text.
 *
 * @param line 1-based line number
 * @param column 1-based column within the line
 * @param offset 0-based character offset from the start of the source
 */
public record Position(int line, int column, int offset) {

  /** The position of the first character of any source. */
  public static final Position START = new Position(1, 1, 0);

  public Position {
    if (line < 1 || column < 1 || offset < 0) {
      throw new IllegalArgumentException(
          "Invalid position: line=" + line + ", column=" + column + ", offset=" + offset);
    }
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
