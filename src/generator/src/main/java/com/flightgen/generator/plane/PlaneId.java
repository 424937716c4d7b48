package com.flightgen.generator.plane;

import com.flightgen.generator.config.ConfigurationException;
import java.util.regex.Pattern;

/**
 * Four-character plane identifier ({@code AA00}..{@code ZZ99}).
 *
 * <p>Identifiers form a mixed-radix space of {@value #SPACE_SIZE} values ordered by first
 * letter, second letter, then the two-digit number. The record holds the integer index in that
 * order; the textual form is derived from it.
 */
public record PlaneId(int index) implements Comparable<PlaneId> {
  public static final int SPACE_SIZE = 26 * 26 * 100;

  private static final Pattern FORMAT = Pattern.compile("^[A-Z]{2}[0-9]{2}$");

  public PlaneId {
    if (index < 0 || index >= SPACE_SIZE) {
      throw new IllegalArgumentException("plane id index out of range: " + index);
    }
  }

  /**
   * Parses the textual form of an identifier.
   *
   * @param raw identifier such as {@code AB12}
   * @return parsed identifier
   * @throws ConfigurationException when {@code raw} is not two uppercase letters and two digits
   */
  public static PlaneId parse(String raw) {
    if (raw == null || !FORMAT.matcher(raw).matches()) {
      throw new ConfigurationException("plane id must match [A-Z]{2}[0-9]{2} (was '" + raw + "')");
    }
    int first = raw.charAt(0) - 'A';
    int second = raw.charAt(1) - 'A';
    int number = Integer.parseInt(raw.substring(2));
    return new PlaneId((first * 26 + second) * 100 + number);
  }

  /**
   * Returns the identifier {@code offset} positions after {@code start}.
   *
   * @param start first identifier of the allocation
   * @param offset non-negative distance from {@code start}
   * @return the identifier at {@code start + offset}
   * @throws RangeExceededException when the result would be past {@code ZZ99}
   */
  public static PlaneId identifierAt(PlaneId start, long offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0 (was " + offset + ")");
    }
    long target = start.index() + offset;
    if (target >= SPACE_SIZE) {
      throw new RangeExceededException(start, offset);
    }
    return new PlaneId((int) target);
  }

  /** Number of identifiers available from this one up to and including {@code ZZ99}. */
  public int remaining() {
    return SPACE_SIZE - index;
  }

  @Override
  public int compareTo(PlaneId other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    int number = index % 100;
    int letters = index / 100;
    char first = (char) ('A' + letters / 26);
    char second = (char) ('A' + letters % 26);
    return "" + first + second + (number < 10 ? "0" : "") + number;
  }
}
