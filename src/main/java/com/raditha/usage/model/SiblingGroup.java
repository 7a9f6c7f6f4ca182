package com.raditha.usage.model;

/**
 * Membership of a declaration in a multi-declarator statement such as {@code private int a, b;}.
 * Reported with each finding so that a consumer can tell whether the whole statement or a
 * single declarator is affected.
 *
 * @param groupId identifier shared by all declarators of the statement
 * @param index   zero based position of this declarator in the statement
 * @param size    number of declarators in the statement
 */
public record SiblingGroup(String groupId, int index, int size) {

    public SiblingGroup {
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1");
        }
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException("index must be between 0 and " + (size - 1));
        }
    }

    /**
     * True when the statement declares more than one variable.
     */
    public boolean hasSiblings() {
        return size > 1;
    }
}
