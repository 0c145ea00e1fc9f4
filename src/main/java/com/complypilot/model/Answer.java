package com.complypilot.model;

/**
 * A submitted yes/no answer to a catalog question.
 *
 * @param questionId Catalog question id; unknown ids are ignored by scoring
 * @param answer     {@code true} when the control is in place; {@code null} counts as unanswered
 * @param notes      Optional free-text note
 */
public record Answer(String questionId, Boolean answer, String notes) {}
