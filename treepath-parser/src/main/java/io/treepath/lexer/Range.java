package io.treepath.lexer;

/**
 * A half-open span of source text. {@code end} points just past the last character.
 *
 * @param start first position covered
 * @param end position after the last character covered
 */
public record Range(Position start, Position end) {

  public Range {
    if (start == null || end == null) {
      throw new IllegalArgumentException("Range bounds cannot be null");
    }
    if (end.offset() < start.offset()) {
      throw new IllegalArgumentException("Range end " + end + " precedes start " + start);
    }
  }

  /** Creates an empty range located at {@code position}. */
  public static Range at(Position position) {
    return new Range(position, position);
  }

  /** Smallest range covering both {@code first} and {@code last}. */
  public static Range covering(Range first, Range last) {
    Position start = first.start.offset() <= last.start.offset() ? first.start : last.start;
    Position end = first.end.offset() >= last.end.offset() ? first.end : last.end;
    return new Range(start, end);
  }

  public int length() {
    return end.offset() - start.offset();
  }

  /** Checks whether {@code offset} lies inside this range, boundaries included. */
  public boolean contains(int offset) {
    return offset >= start.offset() && offset <= end.offset();
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}
