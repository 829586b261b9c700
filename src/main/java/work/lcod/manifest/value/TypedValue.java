package work.lcod.manifest.value;

import work.lcod.manifest.schema.FieldSchema;

/**
 * Node of a value tree whose shape follows a {@link FieldSchema}.
 *
 * <p>Besides concrete values a node can be {@link PendingValue} (not known yet, to be computed by the next plan),
 * {@link NullValue} (explicitly unset) or {@link UndeterminedValue}, the converter's placeholder for data the live
 * object did not provide. Placeholders never leave the conversion stage: the backfill pass replaces them.
 */
public interface TypedValue {
    FieldSchema type();
}
