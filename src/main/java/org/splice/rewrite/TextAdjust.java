package org.splice.rewrite;

public enum TextAdjust {
    NONE,
    PARENTHESIZE
}
