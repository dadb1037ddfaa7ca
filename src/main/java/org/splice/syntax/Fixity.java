package org.splice.syntax;

public enum Fixity {
    LEFT,
    RIGHT,
    NONE
}
