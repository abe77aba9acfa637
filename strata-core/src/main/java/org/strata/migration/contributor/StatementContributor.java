package org.strata.migration.contributor;

import org.strata.migration.spi.dialect.DdlDialect;

import java.util.List;

/**
 * Produces complete statements of its own.
 */
public interface StatementContributor extends SqlContributor {
    List<String> statements(DdlDialect dialect);
}
