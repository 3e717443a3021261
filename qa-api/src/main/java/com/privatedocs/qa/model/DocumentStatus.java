package com.privatedocs.qa.model;

public enum DocumentStatus {
    PENDING,
    INDEXED,
    FAILED
}
