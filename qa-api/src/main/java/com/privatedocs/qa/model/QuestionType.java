package com.privatedocs.qa.model;

public enum QuestionType {
    SUMMARY,
    SPECIFIC,
    COMPARISON,
    ANALYSIS,
    GENERAL
}
