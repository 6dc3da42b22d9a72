package com.runeledger.model;

public enum EquipmentSlotType {
    HEAD,
    CAPE,
    NECK,
    AMMO,
    WEAPON,
    BODY,
    SHIELD,
    LEGS,
    HANDS,
    FEET,
    RING
}
