package db.embed.storage;

import db.embed.catalog.DataType;

/**
 * A single cell value. Either a 64-bit integer or a text string; equality is structural and
 * values of different kinds are never equal (no coercion).
 */
public sealed interface Value permits IntValue, TextValue {

    DataType type();

    /** Raw rendering without literal quoting, used by printers. */
    String display();

    static Value of(long v) { return new IntValue(v); }

    static Value of(String v) { return new TextValue(v); }
}
