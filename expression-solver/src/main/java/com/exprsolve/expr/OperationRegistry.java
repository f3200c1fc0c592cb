package com.exprsolve.expr;

import java.util.*;

/**
 * Lookup table from identifiers to operations, split by syntactic role.
 * Populated once when a solver is created and only read afterwards.
 */
public class OperationRegistry {

    private final Map<String, Operation> operators = new HashMap<>();
    private final Map<String, Operation> functions = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();

    public void registerOperator(String symbol, Operation op) {
        operators.put(symbol, op);
    }

    public void registerFunction(String name, Operation op, String... alternativeNames) {
        String key = name.toLowerCase();
        // a function name takes precedence over an alias spelled the same way
        aliases.remove(key);
        functions.put(key, op);
        for (String alias : alternativeNames) aliases.put(alias.toLowerCase(), key);
    }

    public void registerAlias(String alias, String target) {
        String key = resolve(target);
        if (!functions.containsKey(key)) {
            throw new IllegalArgumentException("Cannot alias " + alias + " to unknown function " + target);
        }
        aliases.put(alias.toLowerCase(), key);
    }

    public Operation getOperator(String symbol) {
        return operators.get(symbol);
    }

    public Operation getFunction(String name) {
        return functions.get(resolve(name));
    }

    public boolean containsFunction(String name) {
        return functions.containsKey(resolve(name));
    }

    public Set<String> getFunctionNames() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    private String resolve(String name) {
        return aliases.getOrDefault(name.toLowerCase(), name.toLowerCase());
    }
}
