package com.oregontrail.vehicle;

import lombok.Getter;

/**
 * How hard the party pushes the vehicle each day.
 */
public enum TravelPace {

    STEADY(1.0),
    STRENUOUS(1.5),
    GRUELING(2.0);

    /**
     * Multiplier applied to the vehicle base mileage.
     */
    @Getter
    private final double mileageMultiplier;

    TravelPace(double mileageMultiplier) {
        this.mileageMultiplier = mileageMultiplier;
    }
}
