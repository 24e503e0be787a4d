package com.oregontrail.vehicle;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.Assert.*;

public class VehicleTest {

    private Vehicle vehicle;

    @Before
    public void setUp() {
        Map<SimulationEntity, Double> inventory = new EnumMap<>(SimulationEntity.class);
        inventory.put(SimulationEntity.ANIMAL, 4.0);
        inventory.put(SimulationEntity.FOOD, 100.0);
        inventory.put(SimulationEntity.CASH, 50.0);
        vehicle = new Vehicle(20, TravelPace.STEADY, inventory);
    }

    @Test
    public void testNewVehicle_Parked() {
        assertTrue(vehicle.isParked());
        assertEquals(0, vehicle.getMileage());
    }

    @Test
    public void testGetMileage_Rolling_ScaledByPace() {
        vehicle.resume();
        assertEquals(20, vehicle.getMileage());

        vehicle.setPace(TravelPace.STRENUOUS);
        assertEquals(30, vehicle.getMileage());

        vehicle.setPace(TravelPace.GRUELING);
        assertEquals(40, vehicle.getMileage());
    }

    @Test
    public void testGetMileage_NoOxen_Zero() {
        vehicle.resume();
        vehicle.removeQuantity(SimulationEntity.ANIMAL, 4);

        assertEquals(0, vehicle.getMileage());
    }

    @Test
    public void testDailyMileage_IgnoresParking() {
        assertTrue(vehicle.isParked());
        assertEquals(20, vehicle.dailyMileage());

        vehicle.removeQuantity(SimulationEntity.ANIMAL, 4);
        assertEquals(0, vehicle.dailyMileage());
    }

    @Test
    public void testGetInventory_EveryEntityInDeclarationOrder() {
        assertEquals(Arrays.asList(SimulationEntity.values()), new ArrayList<>(vehicle.getInventory().keySet()));
        assertEquals(0.0, vehicle.getQuantity(SimulationEntity.AMMO), 0.0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testGetInventory_ReadOnly() {
        vehicle.getInventory().clear();
    }

    @Test
    public void testRemoveQuantity_MoreThanCarried_FloorsAtZero() {
        double removed = vehicle.removeQuantity(SimulationEntity.FOOD, 250);

        assertEquals(100.0, removed, 0.0);
        assertEquals(0.0, vehicle.getQuantity(SimulationEntity.FOOD), 0.0);
    }

    @Test
    public void testAddQuantity() {
        vehicle.addQuantity(SimulationEntity.FOOD, 25);

        assertEquals(125.0, vehicle.getQuantity(SimulationEntity.FOOD), 0.0);
    }

    @Test
    public void testAddMiles_IgnoresNonPositive() {
        vehicle.addMiles(15);
        vehicle.addMiles(0);
        vehicle.addMiles(-3);

        assertEquals(15, vehicle.getOdometer());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructor_NegativeMileage_Throws() {
        new Vehicle(-1, TravelPace.STEADY, new EnumMap<>(SimulationEntity.class));
    }
}
