// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.evaluation;

import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import mash.util.condition.ConditionContext;

/**
 * A line-oriented statement language for code fragments.
 * <p>
 * Every line holds one statement; blank lines and lines starting with {@code #} are ignored.
 * <ul>
 * <li>{@code name = value} defines or overwrites a variable.
 * <li>{@code print value} writes a line to the output.
 * <li>{@code unset name} removes a variable.
 * <li>{@code fail message} fails the fragment at this line.
 * <li>{@code restart} asks for the whole run to start over.
 * <li>{@code if left == right: statement} runs the statement only if both sides are equal.
 * </ul>
 * Values and messages are taken literally after trimming, except that {@code ${name}} is replaced with the value of
 * the variable, and {@code ${_}} with the composed text of the fragment's enclosing frame.
 */
public final class BuiltinEvaluator implements Evaluator {
    /**
     * Initializes an evaluator that sends the lines written by {@code print} statements to the given consumer.
     */
    public BuiltinEvaluator(final Consumer<String> output) {
        this.output = output;
    }

    @Override
    public void evaluate(final Fragment fragment, final Scope scope) throws EvaluationException {
        final var lines = fragment.source().split("\\n", -1);
        for (int i = 0; i < lines.length; i += 1) {
            final var statement = lines[i].strip();
            if (statement.isEmpty() || statement.startsWith("#")) {
                continue;
            }
            execute(statement, i + 1, fragment, scope);
        }
    }

    private void execute(
        final String statement,
        final int line,
        final Fragment fragment,
        final Scope scope
    ) throws EvaluationException {
        final var conditional = conditionalPattern.matcher(statement);
        if (conditional.matches()) {
            final var left = interpolate(conditional.group(1), line, fragment, scope);
            final var right = interpolate(conditional.group(2), line, fragment, scope);
            if (left.equals(right)) {
                execute(conditional.group(3), line, fragment, scope);
            }
            return;
        }
        final var assignment = assignmentPattern.matcher(statement);
        if (assignment.matches()) {
            scope.put(assignment.group(1), interpolate(assignment.group(2), line, fragment, scope));
            return;
        }
        final var keyword = keywordPattern.matcher(statement);
        if (!keyword.matches()) {
            throw new EvaluationException("Unrecognized statement: " + statement, line);
        }
        final var argument = keyword.group(2);
        switch (keyword.group(1)) {
            case "print" -> output.accept(interpolate(argument, line, fragment, scope));
            case "unset" -> scope.remove(requireName(argument, line));
            case "fail" -> throw new EvaluationException(
                argument.isEmpty() ? "Fragment failed" : interpolate(argument, line, fragment, scope), line);
            case "restart" -> {
                ConditionContext.signal(new RestartRequestCondition(fragment.address().fragmentLine(line)));
                throw new EvaluationException("Restart requested outside of a restartable run", line);
            }
            default -> throw new EvaluationException("Unrecognized statement: " + statement, line);
        }
    }

    private static String requireName(final String argument, final int line) throws EvaluationException {
        if (!namePattern.matcher(argument).matches()) {
            throw new EvaluationException("Not a variable name: " + argument, line);
        }
        return argument;
    }

    private static String interpolate(
        final String value,
        final int line,
        final Fragment fragment,
        final Scope scope
    ) throws EvaluationException {
        final var matcher = referencePattern.matcher(value);
        final var builder = new StringBuilder(value.length());
        while (matcher.find()) {
            final var name = matcher.group(1);
            final String replacement;
            if (name.equals(frameTextName)) {
                replacement = fragment.enclosingFrame().composedText();
            } else {
                final var variable = scope.get(name);
                if (variable == null) {
                    throw new EvaluationException("Undefined variable: " + name, line);
                }
                replacement = variable.toString();
            }
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static final String frameTextName = "_";
    private static final Pattern namePattern = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern referencePattern = Pattern.compile("\\$\\{([^}]*)}");
    private static final Pattern conditionalPattern = Pattern.compile("if\\s+(.*?)\\s*==\\s*(.*?)\\s*:\\s*(.+)");
    private static final Pattern assignmentPattern = Pattern.compile("([A-Za-z_][A-Za-z0-9_.]*)\\s*=(?!=)\\s*(.*)");
    private static final Pattern keywordPattern = Pattern.compile("(print|unset|fail|restart)\\b\\s*(.*)");

    private final Consumer<String> output;
}
