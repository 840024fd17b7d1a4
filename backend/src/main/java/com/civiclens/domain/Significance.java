package com.civiclens.domain;

public enum Significance {
    LOW,
    MEDIUM,
    HIGH
}
