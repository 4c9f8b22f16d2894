package com.optionlab.domain.model;

/**
 * One point of an American exercise boundary: at {@code time} years from now, exercise is optimal
 * at or beyond {@code price}.
 */
public record ExerciseBoundaryPoint(double time, double price) {}
