package com.eainde.stategraph.exception;

import java.util.List;

/**
 * Raised by {@code GraphBuilder.compile(..)} when the declared graph is malformed.
 * Nothing is compiled and no run can start from the rejected definition.
 */
public class GraphDefinitionException extends Exception {

    private final List<String> problems;

    public GraphDefinitionException(List<String> problems) {
        super(buildMessage(problems));
        this.problems = List.copyOf(problems);
    }

    public GraphDefinitionException(String problem) {
        this(List.of(problem));
    }

    public GraphDefinitionException(String problem, Throwable cause) {
        super(buildMessage(List.of(problem)), cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String buildMessage(List<String> problems) {
        if (problems.size() == 1) {
            return "Invalid graph definition: " + problems.get(0);
        }
        StringBuilder sb = new StringBuilder("Invalid graph definition (")
                .append(problems.size()).append(" problems):");
        problems.forEach(p -> sb.append("\n  - ").append(p));
        return sb.toString();
    }
}
