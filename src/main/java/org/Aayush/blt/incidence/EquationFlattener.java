package org.Aayush.blt.incidence;

import org.Aayush.blt.model.Binary;
import org.Aayush.blt.model.Branch;
import org.Aayush.blt.model.Call;
import org.Aayush.blt.model.Comparison;
import org.Aayush.blt.model.Conditional;
import org.Aayush.blt.model.Derivative;
import org.Aayush.blt.model.Equation;
import org.Aayush.blt.model.Expression;
import org.Aayush.blt.model.ForEquation;
import org.Aayush.blt.model.IfEquation;
import org.Aayush.blt.model.IteratorRef;
import org.Aayush.blt.model.Literal;
import org.Aayush.blt.model.Logical;
import org.Aayush.blt.model.ModelInvariantException;
import org.Aayush.blt.model.ModelInvariantValidator;
import org.Aayush.blt.model.SimpleEquation;
import org.Aayush.blt.model.Unary;
import org.Aayush.blt.model.Variable;
import org.Aayush.blt.model.VariableRef;
import org.Aayush.blt.model.WhenEquation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands structured equations into scalar row templates.
 *
 * <ul>
 * <li>{@code for} bodies are copied once per index value; subscripts and iterator references
 * are evaluated to integers so {@code x[i+1]} becomes the scalar name {@code x[3]}.</li>
 * <li>a balanced {@code if}/{@code when} with {@code k} rows per branch yields {@code k}
 * templates; template {@code j} keeps the {@code j}-th equation of every branch as an
 * alternative and all guard conditions.</li>
 * </ul>
 *
 * <p>Not thread-safe; one instance per analysis run.</p>
 */
final class EquationFlattener {

    /**
     * Scalar row before unknown occurrences are collected.
     *
     * @param suffix id suffix appended to the source label.
     * @param alternatives one expression list per branch (lhs then rhs).
     * @param guards resolved guard conditions.
     */
    record RowTemplate(String suffix, List<List<Expression>> alternatives, List<Expression> guards) {
    }

    private final Map<String, Variable> variables;

    EquationFlattener(Map<String, Variable> variables) {
        this.variables = Objects.requireNonNull(variables, "variables");
    }

    /**
     * Flattens one top-level equation.
     */
    List<RowTemplate> flatten(Equation equation) {
        return flatten(equation, equation.label(), Map.of());
    }

    private List<RowTemplate> flatten(Equation equation, String owner, Map<String, Integer> bindings) {
        return switch (equation.kind()) {
            case SIMPLE -> {
                SimpleEquation simple = (SimpleEquation) equation;
                List<Expression> sides = List.of(
                        resolve(simple.lhs(), owner, bindings),
                        resolve(simple.rhs(), owner, bindings)
                );
                yield List.of(new RowTemplate("", List.of(sides), List.of()));
            }
            case FOR -> flattenFor((ForEquation) equation, owner, bindings);
            case IF -> {
                IfEquation ifEquation = (IfEquation) equation;
                List<Expression> guards = new ArrayList<>();
                List<List<RowTemplate>> bodies = new ArrayList<>();
                for (Branch branch : ifEquation.branches()) {
                    guards.add(resolve(branch.condition(), owner, bindings));
                    bodies.add(flattenAll(branch.equations(), owner, bindings));
                }
                bodies.add(flattenAll(ifEquation.elseEquations(), owner, bindings));
                yield merge(bodies, guards);
            }
            case WHEN -> {
                WhenEquation whenEquation = (WhenEquation) equation;
                List<Expression> guards = new ArrayList<>();
                List<List<RowTemplate>> bodies = new ArrayList<>();
                for (Branch branch : whenEquation.branches()) {
                    guards.add(resolve(branch.condition(), owner, bindings));
                    bodies.add(flattenAll(branch.equations(), owner, bindings));
                }
                yield merge(bodies, guards);
            }
        };
    }

    private List<RowTemplate> flattenFor(ForEquation forEquation, String owner, Map<String, Integer> bindings) {
        List<RowTemplate> templates = new ArrayList<>();
        List<Equation> body = forEquation.body();
        for (int value = forEquation.from(); value <= forEquation.to(); value++) {
            Map<String, Integer> scope = new HashMap<>(bindings);
            scope.put(forEquation.iterator(), value);
            String prefix = "[" + forEquation.iterator() + "=" + value + "]";
            for (int j = 0; j < body.size(); j++) {
                String bodyPrefix = body.size() > 1 ? prefix + "." + (j + 1) : prefix;
                for (RowTemplate child : flatten(body.get(j), owner, scope)) {
                    templates.add(new RowTemplate(bodyPrefix + child.suffix(), child.alternatives(), child.guards()));
                }
            }
        }
        return templates;
    }

    private List<RowTemplate> flattenAll(List<Equation> equations, String owner, Map<String, Integer> bindings) {
        List<RowTemplate> templates = new ArrayList<>();
        for (Equation equation : equations) {
            templates.addAll(flatten(equation, owner, bindings));
        }
        return templates;
    }

    /**
     * Zips branch bodies row by row. Branch balance was checked at model construction.
     */
    private static List<RowTemplate> merge(List<List<RowTemplate>> bodies, List<Expression> guards) {
        int rows = bodies.get(0).size();
        List<RowTemplate> merged = new ArrayList<>(rows);
        for (int j = 0; j < rows; j++) {
            List<List<Expression>> alternatives = new ArrayList<>();
            List<Expression> rowGuards = new ArrayList<>(guards);
            for (List<RowTemplate> body : bodies) {
                RowTemplate template = body.get(j);
                alternatives.addAll(template.alternatives());
                rowGuards.addAll(template.guards());
            }
            String suffix = rows > 1 ? "#" + (j + 1) : "";
            merged.add(new RowTemplate(suffix, List.copyOf(alternatives), List.copyOf(rowGuards)));
        }
        return merged;
    }

    /**
     * Returns a copy of {@code expression} with iterators replaced by literals and subscripted
     * references replaced by their scalar names.
     */
    private Expression resolve(Expression expression, String owner, Map<String, Integer> bindings) {
        return switch (expression.kind()) {
            case LITERAL -> expression;
            case VARIABLE -> resolveReference((VariableRef) expression, owner, bindings);
            case ITERATOR -> new Literal(evaluateIndex(expression, owner, bindings));
            case UNARY -> {
                Unary unary = (Unary) expression;
                yield new Unary(unary.operator(), resolve(unary.operand(), owner, bindings));
            }
            case BINARY -> {
                Binary binary = (Binary) expression;
                yield new Binary(
                        binary.operator(),
                        resolve(binary.left(), owner, bindings),
                        resolve(binary.right(), owner, bindings)
                );
            }
            case COMPARISON -> {
                Comparison comparison = (Comparison) expression;
                yield new Comparison(
                        comparison.operator(),
                        resolve(comparison.left(), owner, bindings),
                        resolve(comparison.right(), owner, bindings)
                );
            }
            case LOGICAL -> {
                Logical logical = (Logical) expression;
                yield new Logical(
                        logical.operator(),
                        resolve(logical.left(), owner, bindings),
                        resolve(logical.right(), owner, bindings)
                );
            }
            case DERIVATIVE -> {
                VariableRef argument = resolveReference(((Derivative) expression).argument(), owner, bindings);
                ModelInvariantValidator.requireStateDerivative(owner, argument.name(), variables);
                yield new Derivative(argument);
            }
            case CALL -> {
                Call call = (Call) expression;
                List<Expression> arguments = new ArrayList<>(call.arguments().size());
                for (Expression argument : call.arguments()) {
                    arguments.add(resolve(argument, owner, bindings));
                }
                yield new Call(call.function(), arguments);
            }
            case CONDITIONAL -> {
                Conditional conditional = (Conditional) expression;
                yield new Conditional(
                        resolve(conditional.condition(), owner, bindings),
                        resolve(conditional.whenTrue(), owner, bindings),
                        resolve(conditional.whenFalse(), owner, bindings)
                );
            }
        };
    }

    private VariableRef resolveReference(VariableRef reference, String owner, Map<String, Integer> bindings) {
        if (!reference.hasSubscripts()) {
            return reference;
        }
        StringBuilder name = new StringBuilder(reference.name()).append('[');
        List<Expression> subscripts = reference.subscripts();
        for (int i = 0; i < subscripts.size(); i++) {
            if (i > 0) {
                name.append(',');
            }
            name.append(evaluateIndex(subscripts.get(i), owner, bindings));
        }
        return new VariableRef(name.append(']').toString());
    }

    /**
     * Evaluates an integer subscript over literals, bound iterators and integer arithmetic.
     */
    private static int evaluateIndex(Expression expression, String owner, Map<String, Integer> bindings) {
        switch (expression.kind()) {
            case LITERAL -> {
                double value = ((Literal) expression).value();
                if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
                    throw malformedSubscript(owner, expression);
                }
                return (int) value;
            }
            case ITERATOR -> {
                Integer value = bindings.get(((IteratorRef) expression).name());
                if (value == null) {
                    throw new ModelInvariantException(
                            ModelInvariantValidator.REASON_UNBOUND_ITERATOR,
                            "equation '" + owner + "' references unbound iterator '" + expression + "'"
                    );
                }
                return value;
            }
            case UNARY -> {
                Unary unary = (Unary) expression;
                if (unary.operator() != Unary.Operator.NEG) {
                    throw malformedSubscript(owner, expression);
                }
                int operand = evaluateIndex(unary.operand(), owner, bindings);
                try {
                    return Math.negateExact(operand);
                } catch (ArithmeticException ex) {
                    throw overflowingSubscript(owner, expression, ex);
                }
            }
            case BINARY -> {
                Binary binary = (Binary) expression;
                int left = evaluateIndex(binary.left(), owner, bindings);
                int right = evaluateIndex(binary.right(), owner, bindings);
                try {
                    return switch (binary.operator()) {
                        case ADD -> Math.addExact(left, right);
                        case SUB -> Math.subtractExact(left, right);
                        case MUL -> Math.multiplyExact(left, right);
                        case DIV -> {
                            if (right == 0 || left % right != 0) {
                                throw malformedSubscript(owner, expression);
                            }
                            yield Math.toIntExact((long) left / right);
                        }
                        case POW -> {
                            if (right < 0) {
                                throw malformedSubscript(owner, expression);
                            }
                            yield power(left, right);
                        }
                    };
                } catch (ArithmeticException ex) {
                    throw overflowingSubscript(owner, expression, ex);
                }
            }
            default -> throw malformedSubscript(owner, expression);
        }
    }

    private static int power(int base, int exponent) {
        if (exponent == 0 || base == 1) {
            return 1;
        }
        if (base == 0) {
            return 0;
        }
        if (base == -1) {
            return (exponent & 1) == 0 ? 1 : -1;
        }
        int result = 1;
        for (int i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return result;
    }

    private static ModelInvariantException overflowingSubscript(
            String owner,
            Expression subscript,
            ArithmeticException cause
    ) {
        return new ModelInvariantException(
                ModelInvariantValidator.REASON_MALFORMED_EQUATION,
                "equation '" + owner + "' has subscript '" + subscript + "' outside the int range",
                cause
        );
    }

    private static ModelInvariantException malformedSubscript(String owner, Expression subscript) {
        return new ModelInvariantException(
                ModelInvariantValidator.REASON_MALFORMED_EQUATION,
                "equation '" + owner + "' has non-integer subscript '" + subscript + "'"
        );
    }
}
