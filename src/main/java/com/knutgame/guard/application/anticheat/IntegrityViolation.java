package com.knutgame.guard.application.anticheat;

/**
 * Structural problems that make a submission unusable before any plausibility check runs.
 *
 * @since 0.1.0
 */
public enum IntegrityViolation {
  DURATION_TOO_SHORT("DurationTooShort"),
  DURATION_TOO_LONG("DurationTooLong"),
  TOO_MANY_MOVES("TooManyMoves"),
  TOO_MANY_ITEMS("TooManyItems"),
  DUPLICATE_ITEM("DuplicateItem"),
  DURATION_MISMATCH("DurationMismatch"),
  OUT_OF_BOUNDS("OutOfBounds"),
  ITEM_PICKUP_WRONG_LANE("ItemPickupWrongLane");

  private final String code;

  IntegrityViolation(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
