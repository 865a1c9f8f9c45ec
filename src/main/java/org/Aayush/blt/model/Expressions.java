package org.Aayush.blt.model;

import java.util.Arrays;
import java.util.List;

/**
 * Factory helpers for expression trees.
 */
public final class Expressions {

    private Expressions() {
    }

    public static Literal literal(double value) {
        return new Literal(value);
    }

    public static VariableRef ref(String name) {
        return new VariableRef(name);
    }

    public static VariableRef ref(String name, Expression... subscripts) {
        return new VariableRef(name, Arrays.asList(subscripts));
    }

    public static IteratorRef iterator(String name) {
        return new IteratorRef(name);
    }

    public static Derivative der(String name) {
        return new Derivative(new VariableRef(name));
    }

    public static Derivative der(VariableRef argument) {
        return new Derivative(argument);
    }

    public static Unary neg(Expression operand) {
        return new Unary(Unary.Operator.NEG, operand);
    }

    public static Unary not(Expression operand) {
        return new Unary(Unary.Operator.NOT, operand);
    }

    public static Binary add(Expression left, Expression right) {
        return new Binary(Binary.Operator.ADD, left, right);
    }

    public static Binary sub(Expression left, Expression right) {
        return new Binary(Binary.Operator.SUB, left, right);
    }

    public static Binary mul(Expression left, Expression right) {
        return new Binary(Binary.Operator.MUL, left, right);
    }

    public static Binary div(Expression left, Expression right) {
        return new Binary(Binary.Operator.DIV, left, right);
    }

    public static Binary pow(Expression left, Expression right) {
        return new Binary(Binary.Operator.POW, left, right);
    }

    public static Comparison compare(Comparison.Operator operator, Expression left, Expression right) {
        return new Comparison(operator, left, right);
    }

    public static Comparison lessThan(Expression left, Expression right) {
        return new Comparison(Comparison.Operator.LT, left, right);
    }

    public static Comparison greaterThan(Expression left, Expression right) {
        return new Comparison(Comparison.Operator.GT, left, right);
    }

    public static Logical and(Expression left, Expression right) {
        return new Logical(Logical.Operator.AND, left, right);
    }

    public static Logical or(Expression left, Expression right) {
        return new Logical(Logical.Operator.OR, left, right);
    }

    public static Call call(String function, Expression... arguments) {
        return new Call(function, List.of(arguments));
    }

    public static Conditional conditional(Expression condition, Expression whenTrue, Expression whenFalse) {
        return new Conditional(condition, whenTrue, whenFalse);
    }
}
