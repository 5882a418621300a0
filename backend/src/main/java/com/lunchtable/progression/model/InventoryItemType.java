package com.lunchtable.progression.model;

public enum InventoryItemType {
    CARD,
    PACK,
    TITLE,
    AVATAR
}
