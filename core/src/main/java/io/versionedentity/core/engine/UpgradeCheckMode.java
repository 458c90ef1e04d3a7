package io.versionedentity.core.engine;

/**
 * Whether the migration engine re-checks upgrade outputs.
 *
 * <ul>
 * <li>{@link #LENIENT}: upgrade outputs are trusted as-is (default).</li>
 * <li>{@link #STRICT}: every upgrade output is validated against its target version's schema and
 * a mismatch is logged as a warning. The parse outcome is never changed by this check.</li>
 * </ul>
 */
public enum UpgradeCheckMode {
    /** Trust upgrade outputs (default). */
    LENIENT,

    /** Re-validate each upgrade output and warn on mismatch. */
    STRICT
}
