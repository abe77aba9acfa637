package org.strata.naming;

import java.util.List;

/**
 * Names for constraints and indexes Strata creates on its own.
 */
public interface Naming {
    String uqName(String tableName, List<String> columns);
    String ixName(String tableName, List<String> columns);
}
