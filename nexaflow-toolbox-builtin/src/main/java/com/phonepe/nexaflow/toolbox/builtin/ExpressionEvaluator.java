/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.nexaflow.toolbox.builtin;

import com.google.common.base.Preconditions;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Recursive descent evaluator for arithmetic expressions. Only numbers, the operators {@code + - * / % ^} (and
 * {@code **} for power), parentheses, a fixed set of functions and the constants {@code pi} and {@code e} are
 * accepted. Anything else is rejected, nothing is ever executed.
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary (('^' | '**') unary)?
 * primary    := number | name | name '(' arguments ')' | '(' expression ')'
 * </pre>
 */
public final class ExpressionEvaluator {
    private static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "e", Math.E);
    private static final Map<String, DoubleUnaryOperator> UNARY_FUNCTIONS = Map.of(
            "sqrt", Math::sqrt,
            "sin", Math::sin,
            "cos", Math::cos,
            "tan", Math::tan,
            "log", Math::log,
            "log10", Math::log10,
            "abs", Math::abs,
            "round", value -> (double) Math.round(value));

    private final String text;
    private int position;

    private ExpressionEvaluator(String text) {
        this.text = text;
    }

    /**
     * Evaluate an expression
     *
     * @param expression Expression to evaluate
     * @return Value of the expression
     * @throws IllegalArgumentException if the expression is malformed or uses names that are not allowed
     * @throws ArithmeticException      on division by zero
     */
    public static double evaluate(@NonNull String expression) {
        final var evaluator = new ExpressionEvaluator(expression);
        final var value = evaluator.expression();
        evaluator.skipWhitespace();
        if (!evaluator.atEnd()) {
            throw new IllegalArgumentException("Unexpected '%s' at position %d"
                                                       .formatted(evaluator.peek(), evaluator.position));
        }
        return value;
    }

    /**
     * Formats a result the way a person would write it: whole numbers without a fractional part
     */
    public static String format(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private double expression() {
        var value = term();
        while (true) {
            if (consume('+')) {
                value += term();
            }
            else if (consume('-')) {
                value -= term();
            }
            else {
                return value;
            }
        }
    }

    private double term() {
        var value = unary();
        while (true) {
            if (consume('*')) {
                value *= unary();
            }
            else if (consume('/')) {
                final var divisor = unary();
                if (divisor == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                value /= divisor;
            }
            else if (consume('%')) {
                final var divisor = unary();
                if (divisor == 0) {
                    throw new ArithmeticException("Modulo by zero");
                }
                value = value - divisor * Math.floor(value / divisor);
            }
            else {
                return value;
            }
        }
    }

    private double unary() {
        if (consume('-')) {
            return -unary();
        }
        if (consume('+')) {
            return unary();
        }
        return power();
    }

    private double power() {
        final var base = primary();
        if (lookingAt("**")) {
            position += 2;
            return Math.pow(base, unary());
        }
        if (consume('^')) {
            return Math.pow(base, unary());
        }
        return base;
    }

    private double primary() {
        skipWhitespace();
        if (atEnd()) {
            throw new IllegalArgumentException("Unexpected end of expression");
        }
        final var ch = peek();
        if (consume('(')) {
            final var value = expression();
            expect(')');
            return value;
        }
        if (Character.isDigit(ch) || ch == '.') {
            return number();
        }
        if (Character.isLetter(ch) || ch == '_') {
            return named(identifier());
        }
        throw new IllegalArgumentException("Unexpected '%s' at position %d".formatted(ch, position));
    }

    private double named(String name) {
        final var key = name.toLowerCase(Locale.ROOT);
        skipWhitespace();
        if (!lookingAt("(")) {
            final var constant = CONSTANTS.get(key);
            if (null == constant) {
                throw new IllegalArgumentException("'%s' is not allowed".formatted(name));
            }
            return constant;
        }
        position++;
        final var arguments = arguments();
        final var function = UNARY_FUNCTIONS.get(key);
        if (null != function) {
            checkArity(name, arguments, 1);
            return function.applyAsDouble(arguments.get(0));
        }
        return switch (key) {
            case "min" -> {
                Preconditions.checkArgument(!arguments.isEmpty(), "min needs at least one argument");
                yield arguments.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
            }
            case "max" -> {
                Preconditions.checkArgument(!arguments.isEmpty(), "max needs at least one argument");
                yield arguments.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
            }
            case "pow" -> {
                checkArity(name, arguments, 2);
                yield Math.pow(arguments.get(0), arguments.get(1));
            }
            default -> throw new IllegalArgumentException("'%s' is not allowed".formatted(name));
        };
    }

    private List<Double> arguments() {
        final var arguments = new ArrayList<Double>();
        if (consume(')')) {
            return arguments;
        }
        do {
            arguments.add(expression());
        } while (consume(','));
        expect(')');
        return arguments;
    }

    private double number() {
        final var start = position;
        while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
            position++;
        }
        if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
            final var mark = position;
            position++;
            if (!atEnd() && (peek() == '+' || peek() == '-')) {
                position++;
            }
            if (atEnd() || !Character.isDigit(peek())) {
                position = mark;
            }
            while (!atEnd() && Character.isDigit(peek())) {
                position++;
            }
        }
        final var literal = text.substring(start, position);
        try {
            return Double.parseDouble(literal);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number '%s'".formatted(literal), e);
        }
    }

    private String identifier() {
        final var start = position;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            position++;
        }
        return text.substring(start, position);
    }

    private static void checkArity(String name, List<Double> arguments, int expected) {
        Preconditions.checkArgument(arguments.size() == expected,
                                    "%s takes %s argument(s), got %s", name, expected, arguments.size());
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (!atEnd() && peek() == expected) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        if (!consume(expected)) {
            throw new IllegalArgumentException("Expected '%s' at position %d".formatted(expected, position));
        }
    }

    private boolean lookingAt(String token) {
        skipWhitespace();
        return text.startsWith(token, position);
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            position++;
        }
    }

    private boolean atEnd() {
        return position >= text.length();
    }

    private char peek() {
        return text.charAt(position);
    }
}
