package com.reachscan.adapter.reachability;

/**
 * Traversal state of a function. A function turns IN_PROGRESS when its first block is marked
 * live; marked blocks are never re-entered, which is what stops recursion. Every function that
 * was entered is RESOLVED once the worklist drains.
 */
public enum FunctionState {
    UNVISITED,
    IN_PROGRESS,
    RESOLVED
}
