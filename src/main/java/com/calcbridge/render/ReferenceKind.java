package com.calcbridge.render;

public enum ReferenceKind {
    FIELD,
    PARAMETER
}
