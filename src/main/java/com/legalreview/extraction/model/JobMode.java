package com.legalreview.extraction.model;

public enum JobMode {
    QUICK,
    FULL
}
