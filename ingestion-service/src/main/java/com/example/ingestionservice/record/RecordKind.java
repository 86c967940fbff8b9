package com.example.ingestionservice.record;

public enum RecordKind {
    ISSUE,
    WORKLOG,
    TRANSCRIPT,
    PAGE,
    MESSAGE
}
