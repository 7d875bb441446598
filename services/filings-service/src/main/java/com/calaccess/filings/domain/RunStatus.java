package com.calaccess.filings.domain;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    PARTIAL_SUCCESS,
    FAILED
}
