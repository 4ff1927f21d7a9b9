package com.ospicorp.netload.load.model;

import com.ospicorp.netload.load.exception.InvalidResolutionException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Width of an aggregation bucket. Buckets are anchored at the epoch, so a 15 minute
 * resolution yields buckets at :00, :15, :30 and :45.
 */
public record Resolution(Duration duration) {

  static final Duration MAX = Duration.ofDays(366);

  private static final Pattern SHORTHAND = Pattern.compile("^(\\d+)\\s*(s|S|m|min|T|h|H|d|D)$");

  public Resolution {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new InvalidResolutionException("Resolution must be a positive duration: " + duration);
    }
    if (duration.getNano() != 0) {
      throw new InvalidResolutionException("Resolution must be a whole number of seconds: " + duration);
    }
    if (duration.compareTo(MAX) > 0) {
      throw new InvalidResolutionException("Resolution must not exceed " + MAX.toDays() + " days: "
          + duration);
    }
  }

  public static Resolution ofMinutes(long minutes) {
    return new Resolution(Duration.ofMinutes(minutes));
  }

  /**
   * Parses {@code 15T}, {@code 15min}, {@code 15m}, {@code 1h}, {@code 1d}, {@code 30s} or an
   * ISO-8601 duration such as {@code PT15M}.
   */
  public static Resolution parse(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidResolutionException("Resolution must be provided");
    }
    String trimmed = value.trim();
    if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
      try {
        return new Resolution(Duration.parse(trimmed));
      } catch (DateTimeParseException ex) {
        throw new InvalidResolutionException("Unparseable resolution: " + value, ex);
      }
    }
    Matcher matcher = SHORTHAND.matcher(trimmed);
    if (!matcher.matches()) {
      throw new InvalidResolutionException("Unparseable resolution: " + value);
    }
    long amount;
    try {
      amount = Long.parseLong(matcher.group(1));
    } catch (NumberFormatException ex) {
      throw new InvalidResolutionException("Unparseable resolution: " + value, ex);
    }
    Duration duration;
    try {
      duration = switch (matcher.group(2)) {
        case "s", "S" -> Duration.ofSeconds(amount);
        case "m", "min", "T" -> Duration.ofMinutes(amount);
        case "h", "H" -> Duration.ofHours(amount);
        default -> Duration.ofDays(amount);
      };
    } catch (ArithmeticException ex) {
      throw new InvalidResolutionException("Resolution out of range: " + value, ex);
    }
    return new Resolution(duration);
  }

  public Instant floor(Instant instant) {
    long width = duration.getSeconds();
    long seconds = Math.floorDiv(instant.getEpochSecond(), width) * width;
    return Instant.ofEpochSecond(seconds);
  }

  public Duration times(long periods) {
    try {
      return duration.multipliedBy(periods);
    } catch (ArithmeticException ex) {
      throw new InvalidResolutionException(periods + " periods of " + this + " overflow", ex);
    }
  }

  /** Renders the width as a Flux duration literal. */
  public String toFluxDuration() {
    long seconds = duration.getSeconds();
    if (seconds % 86_400 == 0) {
      return seconds / 86_400 + "d";
    }
    if (seconds % 3_600 == 0) {
      return seconds / 3_600 + "h";
    }
    if (seconds % 60 == 0) {
      return seconds / 60 + "m";
    }
    return seconds + "s";
  }

  @Override
  public String toString() {
    return toFluxDuration();
  }
}
