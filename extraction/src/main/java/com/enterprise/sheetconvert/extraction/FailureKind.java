package com.enterprise.sheetconvert.extraction;

public enum FailureKind {
    /** The document was readable but contained nothing tabular. */
    NO_TABLES_FOUND,
    /** Encrypted, corrupt or not a PDF at all. */
    UNPARSABLE_DOCUMENT,
    /** Worth retrying. */
    TRANSIENT
}
