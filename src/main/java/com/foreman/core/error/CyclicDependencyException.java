package com.foreman.core.error;

import java.util.List;

/**
 * Task insertion rejected because the dependency set would form a cycle.
 */
public class CyclicDependencyException extends ForemanException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Task ids along the detected cycle; first and last entries are the same task. */
    public List<String> getCycle() {
        return cycle;
    }
}
