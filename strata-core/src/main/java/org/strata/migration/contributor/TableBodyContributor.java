package org.strata.migration.contributor;

import org.strata.migration.spi.dialect.DdlDialect;

/**
 * Appends lines inside the parentheses of a CREATE TABLE. Every line ends with {@code ",\n"};
 * the builder trims the last separator.
 */
public interface TableBodyContributor extends SqlContributor {
    void contribute(StringBuilder sb, DdlDialect dialect);
}
