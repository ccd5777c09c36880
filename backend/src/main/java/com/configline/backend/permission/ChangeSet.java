package com.configline.backend.permission;

/**
 * Which parts of a config (or variant) a mutation actually changes. Used by both direct edits and
 * proposal approval so the two paths are gated identically.
 */
public record ChangeSet(
        boolean value,
        boolean overrides,
        boolean description,
        boolean schema,
        boolean useBaseSchema,
        boolean members,
        boolean delete
) {
    public static final ChangeSet NONE = new ChangeSet(false, false, false, false, false, false, false);

    public static ChangeSet deletion() {
        return new ChangeSet(false, false, false, false, false, false, true);
    }

    public boolean isEmpty() {
        return !value && !overrides && !description && !schema && !useBaseSchema && !members && !delete;
    }
}
