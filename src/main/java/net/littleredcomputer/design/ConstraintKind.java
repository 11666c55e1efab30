// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

/**
 * Block-level requirements, in the order they are lowered.
 */
public enum ConstraintKind {
    /** Each factor takes exactly one level in every trial. Always present after allocation. */
    CONSISTENCY,
    /** Every combination of levels of the crossed factors occurs in exactly one trial. */
    FULLY_CROSS,
}
