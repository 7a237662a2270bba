package org.vadalog.vadacode;

public enum TokenTag {
    HEAD,
    BODY,
    DEFINITION
}
