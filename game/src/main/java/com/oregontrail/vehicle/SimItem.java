package com.oregontrail.vehicle;

import lombok.Value;

/**
 * Immutable inventory entry: an entity kind and how much of it is carried.
 * Quantity is a double so cash can carry cents; other entities hold whole numbers.
 */
@Value
public class SimItem {

    SimulationEntity category;

    double quantity;

    /**
     * Display name of the item.
     *
     * @return the entity display name
     */
    public String getName() {
        return category.getDisplayName();
    }

    /**
     * Copy of this item with a different quantity. Negative quantities floor at zero.
     *
     * @param newQuantity the new quantity
     * @return the new item
     */
    public SimItem withQuantity(double newQuantity) {
        return new SimItem(category, Math.max(0, newQuantity));
    }
}
