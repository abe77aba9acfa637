package org.strata.migration;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Order in which new tables are created: ascending {@code order}; inside one order value a
 * table follows the tables it references, remaining ties by table name.
 */
@Slf4j
public final class CreationOrder {

    private CreationOrder() {
    }

    public static <T> List<T> sort(Collection<T> tables,
                                   ToIntFunction<T> order,
                                   Function<T, String> name,
                                   Function<T, Set<String>> references) {
        TreeMap<Integer, List<T>> byOrder = new TreeMap<>();
        for (T table : tables) {
            byOrder.computeIfAbsent(order.applyAsInt(table), k -> new ArrayList<>()).add(table);
        }
        List<T> sorted = new ArrayList<>(tables.size());
        for (List<T> group : byOrder.values()) {
            sorted.addAll(sortGroup(group, name, references));
        }
        return sorted;
    }

    // Kahn's algorithm; the ready queue is ordered by name.
    private static <T> List<T> sortGroup(List<T> group, Function<T, String> name, Function<T, Set<String>> references) {
        Map<String, T> byName = new HashMap<>();
        for (T table : group) {
            byName.put(name.apply(table), table);
        }

        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (T table : group) {
            String tableName = name.apply(table);
            int count = 0;
            for (String target : references.apply(table)) {
                if (!target.equals(tableName) && byName.containsKey(target)) {
                    count++;
                    dependents.computeIfAbsent(target, k -> new ArrayList<>()).add(tableName);
                }
            }
            pending.put(tableName, count);
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        pending.forEach((tableName, count) -> {
            if (count == 0) ready.add(tableName);
        });

        List<T> out = new ArrayList<>(group.size());
        while (!ready.isEmpty()) {
            String tableName = ready.poll();
            out.add(byName.get(tableName));
            for (String dependent : dependents.getOrDefault(tableName, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (out.size() < group.size()) {
            List<T> cyclic = group.stream()
                    .filter(t -> !out.contains(t))
                    .sorted(Comparator.comparing(name))
                    .toList();
            log.warn("Reference cycle among tables {}; creating them by name",
                    cyclic.stream().map(name).toList());
            out.addAll(cyclic);
        }
        return out;
    }
}
