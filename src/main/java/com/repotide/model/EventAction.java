package com.repotide.model;

/**
 * What kind of repository activity a stored event represents.
 * PUSH         → commits pushed to a branch
 * PULL_REQUEST → a pull request was opened, edited, reopened or synchronized
 * MERGE        → a pull request was closed with its changes merged
 */
public enum EventAction {
    PUSH,
    PULL_REQUEST,
    MERGE
}
