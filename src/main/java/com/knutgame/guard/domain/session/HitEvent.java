package com.knutgame.guard.domain.session;

/**
 * Collision between the player and an obstacle.
 *
 * @param timestampMs milliseconds since session start
 * @param x horizontal position of the collision in canvas pixels
 * @param y vertical position of the collision in canvas pixels
 * @since 0.1.0
 */
public record HitEvent(int timestampMs, double x, double y) {}
