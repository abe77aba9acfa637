package org.strata.migration.contributor;

/**
 * A piece of DDL. Contributors of one builder are applied in ascending priority.
 */
public interface SqlContributor {
    int priority();
}
