package com.oregontrail.event;

/**
 * Broad grouping of random events, recorded in the event history.
 */
public enum EventCategory {
    /** Damage to the wagon. */
    VEHICLE,
    /** Other travellers. */
    PERSON,
    /** Something found along the trail. */
    WILD
}
