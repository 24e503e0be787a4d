package com.oregontrail.event;

import lombok.Value;

import java.time.LocalDate;

/**
 * An event that has already happened, stamped with the game date.
 */
@Value
public class EventHistoryItem {

    LocalDate timestamp;

    String eventName;

    EventCategory eventType;
}
