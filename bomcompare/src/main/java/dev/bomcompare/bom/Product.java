package dev.bomcompare.bom;

/**
 * The two BoM products this system ingests.
 */
public enum Product {
    FORECAST,
    OBSERVATION
}
