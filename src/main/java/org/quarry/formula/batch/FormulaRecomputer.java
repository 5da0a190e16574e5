package org.quarry.formula.batch;

import org.quarry.formula.FormulaEngine;
import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.FormulaErrorCode;
import org.quarry.formula.api.FormulaException;
import org.quarry.formula.api.FormulaResult;
import org.quarry.formula.api.ParsedFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Recomputes a set of formula fields that may refer to each other.
 * <p>
 * Formula fields are evaluated in dependency order, and each one sees the values computed before it
 * as regular fields. Fields on a dependency cycle (self-references included), and every field that
 * depends on one, fail with {@link FormulaErrorCode#CIRCULAR_REFERENCE}. A failing field never stops
 * the rest of the batch.
 */
public class FormulaRecomputer {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaRecomputer.class);

    private enum VisitState { VISITING, DONE }

    private final FormulaEngine engine;

    public FormulaRecomputer(FormulaEngine engine) {
        this.engine = engine;
    }

    /**
     * Evaluates every formula of the batch.
     *
     * @param formulasByField Formula source per field name.
     * @param base The context shared by all formulas; its fields are overlaid with computed values.
     * @return A future with one result per field, in the iteration order of {@code formulasByField}.
     *         It never completes exceptionally.
     */
    public CompletableFuture<Map<String, FormulaResult>> recompute(Map<String, String> formulasByField, FormulaContext base) {
        FormulaContext context = base == null ? FormulaContext.create() : base;
        Map<String, FormulaResult> results = new HashMap<>();
        Map<String, ParsedFormula> parsed = new LinkedHashMap<>();

        for (Map.Entry<String, String> entry : formulasByField.entrySet()) {
            try {
                parsed.put(entry.getKey(), engine.parseFormula(entry.getValue()));
            } catch (FormulaException e) {
                LOG.debug("Formula of field '{}' does not parse: {}", entry.getKey(), e.getMessage());
                results.put(entry.getKey(), failure(e.getCode(), e.getMessage(), List.of()));
            }
        }

        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (Map.Entry<String, ParsedFormula> entry : parsed.entrySet()) {
            List<String> targets = new ArrayList<>();
            for (String dependency : entry.getValue().dependencies()) {
                if (formulasByField.containsKey(dependency)) {
                    targets.add(dependency);
                }
            }
            edges.put(entry.getKey(), targets);
        }

        Set<String> cyclic = new LinkedHashSet<>();
        List<String> order = new ArrayList<>();
        Map<String, VisitState> states = new HashMap<>();
        for (String field : edges.keySet()) {
            visit(field, edges, states, new ArrayList<>(), cyclic, order);
        }
        Set<String> blocked = blockedByCycles(edges, cyclic);
        if (!cyclic.isEmpty()) {
            LOG.warn("Circular formula references between fields {}", cyclic);
        }
        for (String field : blocked) {
            String message = cyclic.contains(field)
                    ? "Circular reference involving field '" + field + "'"
                    : "Field '" + field + "' depends on a circular reference";
            results.put(field, failure(FormulaErrorCode.CIRCULAR_REFERENCE, message, dependenciesOf(parsed.get(field))));
        }

        Map<String, Object> values = new LinkedHashMap<>(context.fields());
        for (String failed : results.keySet()) {
            // failed formula fields read as empty, not as stale input values
            values.put(failed, null);
        }
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String field : order) {
            if (blocked.contains(field)) {
                continue;
            }
            chain = chain.thenCompose(ignored -> {
                FormulaContext fieldContext = context.toBuilder().fields(values).build();
                return engine.evaluate(parsed.get(field), fieldContext).thenAccept(result -> {
                    results.put(field, result);
                    values.put(field, result.value());
                });
            });
        }

        return chain.thenApply(ignored -> {
            Map<String, FormulaResult> ordered = new LinkedHashMap<>();
            for (String field : formulasByField.keySet()) {
                ordered.put(field, results.get(field));
            }
            return ordered;
        });
    }

    /**
     * Depth-first walk that appends fields in dependency order and collects the fields found on cycles.
     */
    private static void visit(String field, Map<String, List<String>> edges, Map<String, VisitState> states,
                              List<String> path, Set<String> cyclic, List<String> order) {
        VisitState state = states.get(field);
        if (state == VisitState.DONE || !edges.containsKey(field)) {
            return;
        }
        if (state == VisitState.VISITING) {
            // back edge: everything on the path from the earlier visit onwards forms a cycle
            cyclic.addAll(path.subList(path.indexOf(field), path.size()));
            return;
        }
        states.put(field, VisitState.VISITING);
        path.add(field);
        for (String dependency : edges.get(field)) {
            visit(dependency, edges, states, path, cyclic, order);
        }
        path.remove(path.size() - 1);
        states.put(field, VisitState.DONE);
        order.add(field);
    }

    /**
     * @return The cyclic fields plus every field that reaches one of them.
     */
    private static Set<String> blockedByCycles(Map<String, List<String>> edges, Set<String> cyclic) {
        Set<String> blocked = new LinkedHashSet<>(cyclic);
        boolean changed = !blocked.isEmpty();
        while (changed) {
            changed = false;
            for (Map.Entry<String, List<String>> entry : edges.entrySet()) {
                if (blocked.contains(entry.getKey())) {
                    continue;
                }
                for (String dependency : entry.getValue()) {
                    if (blocked.contains(dependency)) {
                        blocked.add(entry.getKey());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return blocked;
    }

    private static List<String> dependenciesOf(ParsedFormula formula) {
        List<String> dependencies = new ArrayList<>(formula.dependencies());
        dependencies.addAll(formula.mentionDependencies());
        return dependencies;
    }

    private FormulaResult failure(FormulaErrorCode code, String message, List<String> dependencies) {
        return FormulaResult.failure(code, message, engine.getConfig().errorDisplayValue(), dependencies, Instant.now(), 0);
    }
}
