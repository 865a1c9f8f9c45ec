package org.Aayush.blt.model;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Construction-time invariant checks for {@link ClassifiedModel}.
 */
@UtilityClass
public final class ModelInvariantValidator {
    public static final String REASON_DUPLICATE_VARIABLE = "M_DUPLICATE_VARIABLE";
    public static final String REASON_DUPLICATE_EQUATION = "M_DUPLICATE_EQUATION";
    public static final String REASON_STATE_INDEX = "M_STATE_INDEX";
    public static final String REASON_DER_NON_STATE = "M_DER_NON_STATE";
    public static final String REASON_UNBALANCED_BRANCHES = "M_UNBALANCED_BRANCHES";
    public static final String REASON_MALFORMED_EQUATION = "M_MALFORMED_EQUATION";
    public static final String REASON_UNBOUND_ITERATOR = "M_UNBOUND_ITERATOR";

    /**
     * Indexes variables by name, rejecting duplicates.
     *
     * @param variables declared variables in declaration order.
     * @return insertion-ordered name lookup.
     */
    static Map<String, Variable> indexVariables(List<Variable> variables) {
        Map<String, Variable> byName = new LinkedHashMap<>();
        for (Variable variable : variables) {
            if (byName.putIfAbsent(variable.getName(), variable) != null) {
                throw new ModelInvariantException(
                        REASON_DUPLICATE_VARIABLE,
                        "variable '" + variable.getName() + "' is declared more than once"
                );
            }
        }
        return byName;
    }

    /**
     * Validates state indices: every state has one, they are unique and dense, non-states have none.
     */
    static void validateStateIndices(List<Variable> variables) {
        List<Variable> states = new ArrayList<>();
        for (Variable variable : variables) {
            if (variable.isState()) {
                states.add(variable);
            } else if (variable.getStateIndex() != null) {
                throw new ModelInvariantException(
                        REASON_STATE_INDEX,
                        "non-state variable '" + variable.getName() + "' carries state_index "
                                + variable.getStateIndex()
                );
            }
        }

        String[] owners = new String[states.size()];
        for (Variable state : states) {
            Integer index = state.getStateIndex();
            if (index == null) {
                throw new ModelInvariantException(
                        REASON_STATE_INDEX,
                        "state '" + state.getName() + "' has no state_index"
                );
            }
            if (index < 0 || index >= owners.length) {
                throw new ModelInvariantException(
                        REASON_STATE_INDEX,
                        "state '" + state.getName() + "' has state_index " + index
                                + " outside dense range [0, " + owners.length + ")"
                );
            }
            if (owners[index] != null) {
                throw new ModelInvariantException(
                        REASON_STATE_INDEX,
                        "state_index " + index + " is shared by '" + owners[index] + "' and '"
                                + state.getName() + "'"
                );
            }
            owners[index] = state.getName();
        }
    }

    /**
     * Validates one top-level equation of the given section.
     */
    static void validateEquation(Equation equation, EquationSection section, Map<String, Variable> variables) {
        validateEquation(equation, equation.label(), section, variables, Set.of(), false);
    }

    private static void validateEquation(
            Equation equation,
            String owner,
            EquationSection section,
            Map<String, Variable> variables,
            Set<String> iterators,
            boolean insideWhen
    ) {
        switch (equation.kind()) {
            case SIMPLE -> {
                SimpleEquation simple = (SimpleEquation) equation;
                validateExpression(simple.lhs(), owner, variables, iterators);
                validateExpression(simple.rhs(), owner, variables, iterators);
            }
            case FOR -> {
                ForEquation forEquation = (ForEquation) equation;
                if (forEquation.iterationCount() == 0) {
                    throw new ModelInvariantException(
                            REASON_MALFORMED_EQUATION,
                            "equation '" + owner + "' iterates over empty range "
                                    + forEquation.from() + ".." + forEquation.to()
                    );
                }
                if (forEquation.body().isEmpty()) {
                    throw new ModelInvariantException(
                            REASON_MALFORMED_EQUATION,
                            "equation '" + owner + "' has an empty for-body"
                    );
                }
                Set<String> bound = new HashSet<>(iterators);
                bound.add(forEquation.iterator());
                for (Equation nested : forEquation.body()) {
                    validateEquation(nested, owner, section, variables, bound, insideWhen);
                }
            }
            case IF -> {
                IfEquation ifEquation = (IfEquation) equation;
                List<List<Equation>> bodies = new ArrayList<>();
                for (Branch branch : ifEquation.branches()) {
                    validateExpression(branch.condition(), owner, variables, iterators);
                    bodies.add(branch.equations());
                }
                bodies.add(ifEquation.elseEquations());
                for (List<Equation> body : bodies) {
                    for (Equation nested : body) {
                        validateEquation(nested, owner, section, variables, iterators, insideWhen);
                    }
                }
                checkBalanced(owner, bodies);
            }
            case WHEN -> {
                if (section != EquationSection.EVENT) {
                    throw new ModelInvariantException(
                            REASON_MALFORMED_EQUATION,
                            "when-equation '" + owner + "' declared in " + section + " section"
                    );
                }
                if (insideWhen) {
                    throw new ModelInvariantException(
                            REASON_MALFORMED_EQUATION,
                            "when-equation '" + owner + "' is nested inside another when-equation"
                    );
                }
                WhenEquation whenEquation = (WhenEquation) equation;
                List<List<Equation>> bodies = new ArrayList<>();
                for (Branch branch : whenEquation.branches()) {
                    validateExpression(branch.condition(), owner, variables, iterators);
                    for (Equation nested : branch.equations()) {
                        validateEquation(nested, owner, section, variables, iterators, true);
                    }
                    bodies.add(branch.equations());
                }
                checkBalanced(owner, bodies);
            }
        }
    }

    private static void validateExpression(
            Expression expression,
            String owner,
            Map<String, Variable> variables,
            Set<String> iterators
    ) {
        switch (expression.kind()) {
            case LITERAL -> {
            }
            case VARIABLE -> {
                for (Expression subscript : ((VariableRef) expression).subscripts()) {
                    validateExpression(subscript, owner, variables, iterators);
                }
            }
            case ITERATOR -> {
                String name = ((IteratorRef) expression).name();
                if (!iterators.contains(name)) {
                    throw new ModelInvariantException(
                            REASON_UNBOUND_ITERATOR,
                            "equation '" + owner + "' references iterator '" + name
                                    + "' outside of its for-equation"
                    );
                }
            }
            case UNARY -> validateExpression(((Unary) expression).operand(), owner, variables, iterators);
            case BINARY -> {
                Binary binary = (Binary) expression;
                validateExpression(binary.left(), owner, variables, iterators);
                validateExpression(binary.right(), owner, variables, iterators);
            }
            case COMPARISON -> {
                Comparison comparison = (Comparison) expression;
                validateExpression(comparison.left(), owner, variables, iterators);
                validateExpression(comparison.right(), owner, variables, iterators);
            }
            case LOGICAL -> {
                Logical logical = (Logical) expression;
                validateExpression(logical.left(), owner, variables, iterators);
                validateExpression(logical.right(), owner, variables, iterators);
            }
            case DERIVATIVE -> {
                VariableRef argument = ((Derivative) expression).argument();
                validateExpression(argument, owner, variables, iterators);
                // subscripted targets are checked once the subscript is resolved
                if (!argument.hasSubscripts()) {
                    requireStateDerivative(owner, argument.name(), variables);
                }
            }
            case CALL -> {
                for (Expression argument : ((Call) expression).arguments()) {
                    validateExpression(argument, owner, variables, iterators);
                }
            }
            case CONDITIONAL -> {
                Conditional conditional = (Conditional) expression;
                validateExpression(conditional.condition(), owner, variables, iterators);
                validateExpression(conditional.whenTrue(), owner, variables, iterators);
                validateExpression(conditional.whenFalse(), owner, variables, iterators);
            }
        }
    }

    /**
     * Fails when {@code name} is declared but not classified as a state.
     *
     * <p>Undeclared names are left to incidence construction, which reports them as
     * reference errors.</p>
     */
    public static void requireStateDerivative(String owner, String name, Map<String, Variable> variables) {
        Variable target = variables.get(name);
        if (target != null && !target.isState()) {
            throw new ModelInvariantException(
                    REASON_DER_NON_STATE,
                    "equation '" + owner + "' applies der() to " + target.getCategory()
                            + " variable '" + name + "'"
            );
        }
    }

    private static void checkBalanced(String owner, List<List<Equation>> bodies) {
        List<Equation> reference = bodies.get(0);
        int expectedRows = rowCount(reference);
        Set<String> expectedAssigned = assignedVariables(reference);
        for (int i = 1; i < bodies.size(); i++) {
            List<Equation> body = bodies.get(i);
            int rows = rowCount(body);
            if (rows != expectedRows) {
                throw new ModelInvariantException(
                        REASON_UNBALANCED_BRANCHES,
                        "equation '" + owner + "' branch " + i + " has " + rows
                                + " equations, expected " + expectedRows
                );
            }
            Set<String> assigned = assignedVariables(body);
            if (!assigned.equals(expectedAssigned)) {
                throw new ModelInvariantException(
                        REASON_UNBALANCED_BRANCHES,
                        "equation '" + owner + "' branch " + i + " assigns " + assigned
                                + ", expected " + expectedAssigned
                );
            }
        }
    }

    /**
     * Returns the number of scalar rows a list of equations flattens into.
     */
    static int rowCount(List<Equation> equations) {
        int rows = 0;
        for (Equation equation : equations) {
            rows += rowCount(equation);
        }
        return rows;
    }

    static int rowCount(Equation equation) {
        return switch (equation.kind()) {
            case SIMPLE -> 1;
            case FOR -> {
                ForEquation forEquation = (ForEquation) equation;
                yield forEquation.iterationCount() * rowCount(forEquation.body());
            }
            case IF -> rowCount(((IfEquation) equation).branches().get(0).equations());
            case WHEN -> rowCount(((WhenEquation) equation).branches().get(0).equations());
        };
    }

    /**
     * Returns the sorted set of variables appearing as a bare left-hand side.
     */
    static Set<String> assignedVariables(List<Equation> equations) {
        Set<String> assigned = new TreeSet<>();
        for (Equation equation : equations) {
            switch (equation.kind()) {
                case SIMPLE -> {
                    String defined = ((SimpleEquation) equation).definedVariable();
                    if (defined != null) {
                        assigned.add(defined);
                    }
                }
                case FOR -> assigned.addAll(assignedVariables(((ForEquation) equation).body()));
                case IF -> assigned.addAll(assignedVariables(((IfEquation) equation).branches().get(0).equations()));
                case WHEN -> assigned.addAll(assignedVariables(((WhenEquation) equation).branches().get(0).equations()));
            }
        }
        return assigned;
    }
}
