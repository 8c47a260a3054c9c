package com.flowgraph.core.guard;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Named transition guards available to definitions.
 * Passed explicitly to whoever needs it; there is no process-wide instance.
 */
public class GuardRegistry {

    private final Map<String, TransitionGuard> guards = new ConcurrentHashMap<>();

    public GuardRegistry() {
    }

    public GuardRegistry(Collection<? extends TransitionGuard> initial) {
        initial.forEach(this::register);
    }

    /**
     * Register a guard under its own name.
     *
     * @throws IllegalArgumentException if another guard already uses the name
     */
    public void register(TransitionGuard guard) {
        TransitionGuard previous = guards.putIfAbsent(guard.name(), guard);
        if (previous != null && previous != guard) {
            throw new IllegalArgumentException("Transition guard already registered: " + guard.name());
        }
    }

    public Optional<TransitionGuard> find(String name) {
        return Optional.ofNullable(guards.get(name));
    }

    public boolean contains(String name) {
        return name != null && guards.containsKey(name);
    }

    /**
     * Names from the list that nobody registered.
     */
    public List<String> missing(List<String> names) {
        return names.stream()
            .filter(name -> !contains(name))
            .collect(Collectors.toList());
    }

    /**
     * Resolve guards in the order the names are given.
     *
     * @throws IllegalArgumentException if a name is unknown
     */
    public List<TransitionGuard> resolve(List<String> names) {
        List<TransitionGuard> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            resolved.add(find(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown transition guard: " + name)));
        }
        return resolved;
    }
}
