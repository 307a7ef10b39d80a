package com.autograder.adapters;

import com.autograder.exceptions.GradingAdapterException;

/**
 * Grades a single answer against a single question.
 * Calls may be slow; callers bound them with a timeout.
 */
public interface GradingAdapter {

    GradeEvaluation grade(GradingRequest request) throws GradingAdapterException;
}
