package com.reachscan.adapter.ast;

public enum Visibility {
    EXPORTED,
    INTERNAL
}
