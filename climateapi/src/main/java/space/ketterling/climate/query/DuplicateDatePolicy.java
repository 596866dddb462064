package space.ketterling.climate.query;

/**
 * How precipitation values from several stations on the same date collapse
 * into one series entry.
 */
public enum DuplicateDatePolicy {
    /** Later-fetched row overwrites earlier ones. */
    LAST,
    /** Largest non-null value. */
    MAX,
    /** Mean of the non-null values. */
    MEAN
}
