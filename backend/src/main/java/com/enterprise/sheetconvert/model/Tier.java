package com.enterprise.sheetconvert.model;

public enum Tier {
    FREE,
    PAID
}
