package com.repurpose.analysis.model;

public enum ErrorKind {
    /** The collector did not settle within its budget. */
    TIMEOUT,
    /** The collector's own logic failed or it produced nothing. */
    FAULT
}
