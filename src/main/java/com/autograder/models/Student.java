package com.autograder.models;

/**
 * Roster entry. {@code id} is the internal key stored on submissions, {@code studentIdentifier}
 * is the human-facing code teachers type or put into archive entry names (e.g. STU001).
 */
public record Student(String id, String studentIdentifier, String fullName) {
}
