package com.civiclens.domain;

/**
 * Bill field groups watched for changes. {@link #priority()} orders them for notification.
 */
public enum ChangeType {
    STATUS(4),
    TITLE(2),
    ACTION(4),
    COSPONSORS(3),
    SUMMARY(2),
    SPONSOR(2),
    POLICY_AREA(1),
    LAW(5);

    private final int priority;

    ChangeType(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }
}
