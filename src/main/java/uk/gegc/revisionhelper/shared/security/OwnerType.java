package uk.gegc.revisionhelper.shared.security;

/**
 * The two kinds of identity a revision or run can be stamped with.
 * A row carries exactly one of them and keeps it for its whole life.
 */
public enum OwnerType {
    USER,
    SESSION
}
