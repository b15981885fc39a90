package com.knutgame.guard.application.anticheat;

import static com.knutgame.guard.testutil.Sessions.item;
import static com.knutgame.guard.testutil.Sessions.move;
import static com.knutgame.guard.testutil.Sessions.request;
import static com.knutgame.guard.testutil.Sessions.steadyWalk;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.knutgame.guard.domain.session.EventEnvelope;
import com.knutgame.guard.domain.session.ItemEvent;
import com.knutgame.guard.domain.session.ItemKind;
import com.knutgame.guard.domain.session.MoveEvent;
import com.knutgame.guard.domain.session.SubmitSessionRequest;
import com.knutgame.guard.testutil.Sessions;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SessionIntegrityCheckerTest {
  private final SessionIntegrityChecker checker = new SessionIntegrityChecker();

  @Test
  void wellFormedSessionPasses() {
    assertEquals(Optional.empty(), checker.check(steadyWalk()));
  }

  @Test
  void unsortedStreamsAreAccepted() {
    SubmitSessionRequest request = request(
        List.of(move(3000, 430), move(0, 400), move(1500, 415)),
        List.of(item(2500, 425), item(500, 402)));

    assertEquals(Optional.empty(), checker.check(request));
  }

  @Test
  void sessionWithoutEventsPasses() {
    assertEquals(Optional.empty(), checker.check(request(List.of(), List.of())));
  }

  @Test
  void rejectsTooShortSession() {
    assertEquals(Optional.of(IntegrityViolation.DURATION_TOO_SHORT), checker.check(request(999L, List.of(), List.of())));
  }

  @Test
  void rejectsBackwardsClock() {
    assertEquals(Optional.of(IntegrityViolation.DURATION_TOO_SHORT),
        checker.check(request(-5_000L, List.of(), List.of())));
  }

  @Test
  void rejectsTooLongSession() {
    assertEquals(Optional.of(IntegrityViolation.DURATION_TOO_LONG),
        checker.check(request(3_600_001L, List.of(), List.of())));
  }

  @Test
  void rejectsOversizedMoveStream() {
    List<MoveEvent> moves = new ArrayList<>();
    for (int i = 0; i <= SessionIntegrityChecker.MAX_MOVES; i++) {
      moves.add(move(i % 3000, 400));
    }

    assertEquals(Optional.of(IntegrityViolation.TOO_MANY_MOVES), checker.check(request(moves, List.of())));
  }

  @Test
  void rejectsOversizedItemStream() {
    List<ItemEvent> items = new ArrayList<>();
    for (int i = 0; i <= SessionIntegrityChecker.MAX_ITEMS; i++) {
      items.add(new ItemEvent(i, "item-" + i, ItemKind.POINTS, 400, Sessions.LANE_Y));
    }

    assertEquals(Optional.of(IntegrityViolation.TOO_MANY_ITEMS), checker.check(request(List.of(), items)));
  }

  @Test
  void rejectsDuplicatePickup() {
    ItemEvent first = new ItemEvent(1000, "coin-7", ItemKind.POINTS, 400, Sessions.LANE_Y);
    ItemEvent replay = new ItemEvent(2900, "coin-7", ItemKind.POINTS, 410, Sessions.LANE_Y);

    assertEquals(Optional.of(IntegrityViolation.DUPLICATE_ITEM),
        checker.check(request(List.of(move(0, 400), move(3000, 410)), List.of(first, replay))));
  }

  @Test
  void rejectsEventsThatDoNotMatchDuration() {
    assertEquals(Optional.of(IntegrityViolation.DURATION_MISMATCH),
        checker.check(request(List.of(move(0, 400), move(1000, 410)), List.of())));
  }

  @Test
  void toleratesSmallDurationDrift() {
    assertEquals(Optional.empty(), checker.check(request(List.of(move(0, 400), move(2600, 410)), List.of())));
  }

  @Test
  void rejectsMoveOutsideCanvas() {
    assertEquals(Optional.of(IntegrityViolation.OUT_OF_BOUNDS),
        checker.check(request(List.of(move(0, 400), move(3000, 801)), List.of())));
    assertEquals(Optional.of(IntegrityViolation.OUT_OF_BOUNDS),
        checker.check(request(List.of(move(0, -1), move(3000, 10)), List.of())));
  }

  @Test
  void rejectsItemOutsideCanvas() {
    ItemEvent below = new ItemEvent(3000, "item-x", ItemKind.POINTS, 400, 601);

    assertEquals(Optional.of(IntegrityViolation.OUT_OF_BOUNDS),
        checker.check(request(List.of(move(0, 400)), List.of(below))));
  }

  @Test
  void rejectsNonFiniteCoordinates() {
    ItemEvent nanX = new ItemEvent(3000, "item-nan", ItemKind.POINTS, Double.NaN, Sessions.LANE_Y);
    ItemEvent infiniteY = new ItemEvent(3000, "item-inf", ItemKind.POINTS, 400, Double.POSITIVE_INFINITY);

    assertEquals(Optional.of(IntegrityViolation.OUT_OF_BOUNDS),
        checker.check(request(List.of(move(0, 400)), List.of(nanX))));
    assertEquals(Optional.of(IntegrityViolation.OUT_OF_BOUNDS),
        checker.check(request(List.of(move(0, 400)), List.of(infiniteY))));
    assertEquals(Optional.of(IntegrityViolation.OUT_OF_BOUNDS),
        checker.check(request(List.of(move(0, Double.NaN), move(3000, 400)), List.of())));
  }

  @Test
  void rejectsPickupOffThePlayerLane() {
    ItemEvent sky = new ItemEvent(3000, "item-sky", ItemKind.SLOWMO, 400, 300);

    assertEquals(Optional.of(IntegrityViolation.ITEM_PICKUP_WRONG_LANE),
        checker.check(request(List.of(move(0, 400)), List.of(sky))));
  }

  @Test
  void acceptsPickupAtLaneEdge() {
    ItemEvent edge = new ItemEvent(3000, "item-edge", ItemKind.POINTS, 400, 540 - 64);

    assertEquals(Optional.empty(), checker.check(request(List.of(move(0, 400)), List.of(edge))));
  }

  @Test
  void reportsFirstViolationInDeclarationOrder() {
    SubmitSessionRequest request = new SubmitSessionRequest(
        UUID.randomUUID(), 800, 600, Sessions.START, Sessions.START.plusMillis(500L),
        new EventEnvelope(List.of(move(0, 9_999)), null, null));

    assertEquals(Optional.of(IntegrityViolation.DURATION_TOO_SHORT), checker.check(request));
  }

  @Test
  void violationCodesAreStable() {
    assertEquals("DuplicateItem", IntegrityViolation.DUPLICATE_ITEM.code());
    assertEquals("ItemPickupWrongLane", IntegrityViolation.ITEM_PICKUP_WRONG_LANE.code());
  }
}
