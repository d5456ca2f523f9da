package com.skillforge.engine.model;

/**
 * Parameter collection lifecycle:
 *
 *   COLLECTING(group 0..n-1) ──► COMPLETE
 *        └──────────────────────► ABANDONED   (timeout or cancel)
 */
public enum SessionStatus {
    COLLECTING,
    COMPLETE,
    ABANDONED
}
