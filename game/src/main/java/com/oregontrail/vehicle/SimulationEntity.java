package com.oregontrail.vehicle;

import lombok.Getter;

/**
 * Kinds of items the vehicle can carry.
 * Declaration order is the display order used by every inventory listing.
 */
public enum SimulationEntity {

    ANIMAL("Oxen"),
    CLOTHING("Clothing"),
    AMMO("Ammunition"),
    WHEEL("Spare Wheels"),
    AXLE("Spare Axles"),
    TONGUE("Spare Tongues"),
    FOOD("Food"),

    /**
     * Money. Formatted as currency rather than a count.
     */
    CASH("Cash");

    @Getter
    private final String displayName;

    SimulationEntity(String displayName) {
        this.displayName = displayName;
    }
}
