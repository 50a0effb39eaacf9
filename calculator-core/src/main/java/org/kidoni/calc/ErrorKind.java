package org.kidoni.calc;

public enum ErrorKind {
    SYNTAX,
    UNKNOWN_NAME,
    UNKNOWN_FUNCTION,
    UNSUPPORTED_NODE,
    DIVISION_BY_ZERO,
    OVERFLOW,
    DOMAIN,
    VALIDATION,
    ARITY,
    RESOURCE_LIMIT
}
