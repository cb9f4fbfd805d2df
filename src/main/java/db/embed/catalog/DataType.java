package db.embed.catalog;

/**
 * Supported primitive column data types
 */
public enum DataType {
    INT,
    TEXT;
}
