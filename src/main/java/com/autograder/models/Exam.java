package com.autograder.models;

/**
 * An exam paper. Immutable for the pipeline.
 */
public record Exam(String id, String name, double totalMarks) {
}
