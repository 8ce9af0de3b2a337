package com.smurthy.ai.assistant.tools.providers;

import com.smurthy.ai.assistant.tools.ToolBinding;
import com.smurthy.ai.assistant.tools.ToolCategory;
import com.smurthy.ai.assistant.tools.ToolExecutionException;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolProvider;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calculator and password generator.
 */
@Component
public class UtilityToolProvider implements ToolProvider {

    static final int MIN_PASSWORD_LENGTH = 8;
    static final int MAX_PASSWORD_LENGTH = 64;
    static final int DEFAULT_PASSWORD_LENGTH = 12;

    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    private static final String DIGITS = "0123456789";
    private static final String SYMBOLS = "!@#$%^&*()-_=+[]{}";

    private static final Pattern EXPRESSION = Pattern.compile("[-+*/%^().\\d\\s]*\\d[-+*/%^().\\d\\s]*");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private final Random random;

    public UtilityToolProvider() {
        this(new SecureRandom());
    }

    UtilityToolProvider(Random random) {
        this.random = random;
    }

    @Override
    public List<ToolBinding> getTools() {
        return List.of(
                new ToolBinding(ToolMetadata.builder("calculate_expression", ToolCategory.UTILITIES)
                        .description("Evaluate an arithmetic expression with + - * / % ^ and parentheses")
                        .keywords("calculate", "compute", "math", "plus", "minus", "times", "divided")
                        .priority(9)
                        .minConfidence(0.2)
                        .estimatedCost(0.1)
                        .asyncCapable(false)
                        .build(), this::calculate),
                new ToolBinding(ToolMetadata.builder("generate_password", ToolCategory.UTILITIES)
                        .description("Generate a strong random password (length 8 to 64, default 12)")
                        .keywords("password", "passcode", "secure")
                        .priority(7)
                        .minConfidence(0.2)
                        .estimatedCost(0.1)
                        .asyncCapable(false)
                        .build(), this::generatePassword)
        );
    }

    String calculate(String query) {
        String expression = extractExpression(query);
        double value = new ExpressionParser(expression).parse();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ToolExecutionException("Result of '" + expression + "' is undefined");
        }
        return expression + " = " + format(value);
    }

    String generatePassword(String query) {
        int length = DEFAULT_PASSWORD_LENGTH;
        Matcher matcher = NUMBER.matcher(query == null ? "" : query);
        if (matcher.find()) {
            length = Math.max(MIN_PASSWORD_LENGTH, Math.min(MAX_PASSWORD_LENGTH, Integer.parseInt(matcher.group())));
        }

        String all = UPPER + LOWER + DIGITS + SYMBOLS;
        List<Character> chars = new ArrayList<>(length);
        // one of each class, then fill
        chars.add(pick(UPPER));
        chars.add(pick(LOWER));
        chars.add(pick(DIGITS));
        chars.add(pick(SYMBOLS));
        while (chars.size() < length) {
            chars.add(pick(all));
        }
        Collections.shuffle(chars, random);

        StringBuilder password = new StringBuilder(length);
        chars.forEach(password::append);
        return "Generated password (" + length + " characters): " + password;
    }

    private char pick(String alphabet) {
        return alphabet.charAt(random.nextInt(alphabet.length()));
    }

    static String extractExpression(String query) {
        if (query == null) {
            throw new ToolExecutionException("No expression given");
        }
        String text = query.toLowerCase(Locale.ROOT)
                .replaceAll("\\bdivided by\\b", "/")
                .replaceAll("\\b(multiplied by|times)\\b", "*")
                .replaceAll("\\bplus\\b", "+")
                .replaceAll("\\bminus\\b", "-")
                .replaceAll("\\bmod(ulo)?\\b", "%")
                .replaceAll("\\bto the power of\\b", "^")
                .replaceAll("(?<=\\d)\\s*x\\s*(?=[\\d(])", "*");

        String best = "";
        Matcher matcher = EXPRESSION.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group().trim().replaceAll("[.\\s]+$", "");
            if (candidate.length() > best.length()) {
                best = candidate;
            }
        }
        if (best.isEmpty()) {
            throw new ToolExecutionException("No arithmetic expression found in: " + query);
        }
        return best;
    }

    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.6g", value).replaceAll("\\.?0+$", "");
    }

    /**
     * Recursive descent over: expr := term (('+'|'-') term)* ; term := factor (('*'|'/'|'%') factor)* ;
     * factor := unary ('^' factor)? ; unary := '-' unary | '(' expr ')' | number
     */
    static final class ExpressionParser {

        private final String input;
        private int pos;

        ExpressionParser(String input) {
            this.input = input;
        }

        double parse() {
            double value = expression();
            skipSpaces();
            if (pos != input.length()) {
                throw new ToolExecutionException("Unexpected '" + input.charAt(pos) + "' in expression: " + input);
            }
            return value;
        }

        private double expression() {
            double value = term();
            while (true) {
                if (accept('+')) {
                    value += term();
                } else if (accept('-')) {
                    value -= term();
                } else {
                    return value;
                }
            }
        }

        private double term() {
            double value = factor();
            while (true) {
                if (accept('*')) {
                    value *= factor();
                } else if (accept('/')) {
                    double divisor = factor();
                    if (divisor == 0) {
                        throw new ToolExecutionException("Division by zero");
                    }
                    value /= divisor;
                } else if (accept('%')) {
                    double divisor = factor();
                    if (divisor == 0) {
                        throw new ToolExecutionException("Division by zero");
                    }
                    value %= divisor;
                } else {
                    return value;
                }
            }
        }

        private double factor() {
            double base = unary();
            if (accept('^')) {
                return Math.pow(base, factor());
            }
            return base;
        }

        private double unary() {
            if (accept('-')) {
                return -unary();
            }
            if (accept('+')) {
                return unary();
            }
            if (accept('(')) {
                double value = expression();
                if (!accept(')')) {
                    throw new ToolExecutionException("Missing ')' in expression: " + input);
                }
                return value;
            }
            return number();
        }

        private double number() {
            skipSpaces();
            int start = pos;
            while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
                pos++;
            }
            if (start == pos) {
                throw new ToolExecutionException("Expected a number at position " + start + " in: " + input);
            }
            try {
                return Double.parseDouble(input.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new ToolExecutionException("Invalid number '" + input.substring(start, pos) + "'", e);
            }
        }

        private boolean accept(char expected) {
            skipSpaces();
            if (pos < input.length() && input.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private void skipSpaces() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }
    }
}
