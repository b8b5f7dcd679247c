package com.farmket.marketplace.model;

public enum UnitOfMeasure {
    KG,
    GRAM,
    LB,
    PIECE,
    DOZEN,
    BUNCH,
    BOX
}
