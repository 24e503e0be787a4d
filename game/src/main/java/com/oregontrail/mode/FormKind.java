package com.oregontrail.mode;

/**
 * Forms a mode can attach, created by {@link FormFactory}.
 */
public enum FormKind {
    CONTINUE_ON_TRAIL,
    CHECK_SUPPLIES,
    LOCATION_FORK,
    LOCATION_DEPART,
    LOOK_AT_MAP,
    RANDOM_EVENT
}
