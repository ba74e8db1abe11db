package com.github.droe.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.droe.parser.Program.ArithmeticOp;
import com.github.droe.parser.Program.ArrayLiteral;
import com.github.droe.parser.Program.BinaryOp;
import com.github.droe.parser.Program.ElementAccess;
import com.github.droe.parser.Program.Expression;
import com.github.droe.parser.Program.FormatExpression;
import com.github.droe.parser.Program.Identifier;
import com.github.droe.parser.Program.Invocation;
import com.github.droe.parser.Program.Literal;
import com.github.droe.parser.Program.PropertyAccess;
import com.github.droe.parser.Program.StringInterpolation;

/**
 * Turns a single expression fragment into an {@link Expression}. Rules are tried in a fixed
 * order and the first match wins; operators are only recognised at top level, so quoted
 * text and bracketed sub-expressions are never split.
 */
public class ExpressionParser {

    /** Natural-language comparisons. Longer phrases come before their prefixes. */
    static final List<Operator> NATURAL_COMPARISONS = List.of(
            new Operator(" is greater than or equal to ", ">="),
            new Operator(" is less than or equal to ", "<="),
            new Operator(" is greater than ", ">"),
            new Operator(" is less than ", "<"),
            new Operator(" does not equal ", "!="),
            new Operator(" is not equal to ", "!="),
            new Operator(" is not ", "!="),
            new Operator(" equals ", "=="),
            new Operator(" is equal to ", "=="),
            new Operator(" is ", "=="));

    static final List<Operator> SYMBOLIC_COMPARISONS = List.of(
            new Operator(">=", ">="),
            new Operator("<=", "<="),
            new Operator("==", "=="),
            new Operator("!=", "!="),
            new Operator(">", ">"),
            new Operator("<", "<"));

    static final List<Operator> ADDITIVE = List.of(
            new Operator(" plus ", "+"),
            new Operator(" minus ", "-"),
            new Operator("+", "+"),
            new Operator("-", "-"));

    static final List<Operator> MULTIPLICATIVE = List.of(
            new Operator(" times ", "*"),
            new Operator(" divided by ", "/"),
            new Operator("*", "*"),
            new Operator("/", "/"),
            new Operator("%", "%"));

    static final List<Operator> OR = List.of(new Operator(" or ", "||"), new Operator("||", "||"));
    static final List<Operator> AND = List.of(new Operator(" and ", "&&"), new Operator("&&", "&&"));

    record Operator(String image, String symbol) {}

    private record Split(int index, Operator operator) {}

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");
    private static final Pattern QUALIFIED_NAME = Pattern.compile("([A-Za-z_]\\w*)(?:\\.([A-Za-z_]\\w*))?");
    private static final Pattern RUN = Pattern.compile("(?i)run\\s+([A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)?)(?:\\s+with\\s+(.+))?");
    private static final Pattern CALL_WITH = Pattern.compile("([A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)?)\\s+with\\s+(.+)");
    private static final Pattern PAREN_CALL = Pattern.compile("([A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)?)\\s*\\(");
    private static final Pattern FORMAT_CALL = Pattern.compile("(?i)format\\s*\\(");

    public Expression parse(String text) {
        var expr = stripEnclosingParentheses(text.trim());
        if (expr.isEmpty()) {
            throw new ParseException("Empty expression");
        }

        var format = parseFormat(expr);
        if (format.isPresent()) {
            return format.get();
        }

        var lower = expr.toLowerCase();
        if (lower.equals("true") || lower.equals("the condition is true")) {
            return Literal.of(true);
        }
        if (lower.equals("false") || lower.equals("the condition is false")) {
            return Literal.of(false);
        }

        if (expr.startsWith("[") && TextScanner.matchingClose(expr, 0) == expr.length() - 1) {
            return parseArrayLiteral(expr.substring(1, expr.length() - 1));
        }

        if (TextScanner.isQuoted(expr)) {
            return parseString(expr);
        }

        if (INTEGER.matcher(expr).matches()) {
            try {
                return Literal.of(Long.parseLong(expr));
            } catch (NumberFormatException e) {
                throw new ParseException("Integer literal out of range: " + expr);
            }
        }
        if (DECIMAL.matcher(expr).matches()) {
            return Literal.of(Double.parseDouble(expr));
        }

        var run = RUN.matcher(expr);
        if (run.matches()) {
            return invocation(run.group(1), run.group(2));
        }
        var callWith = CALL_WITH.matcher(expr);
        if (callWith.matches() && !callWith.group(1).equalsIgnoreCase("format")) {
            return invocation(callWith.group(1), callWith.group(2));
        }

        var logical = splitLast(expr, OR);
        if (logical.isEmpty()) {
            logical = splitLast(expr, AND);
        }
        if (logical.isPresent()) {
            return binary(expr, logical.get());
        }

        var comparison = splitFirst(expr, NATURAL_COMPARISONS);
        if (comparison.isEmpty()) {
            comparison = splitFirst(expr, SYMBOLIC_COMPARISONS);
        }
        if (comparison.isPresent()) {
            return binary(expr, comparison.get());
        }

        var arithmetic = parseArithmetic(expr);
        if (arithmetic.isPresent()) {
            return arithmetic.get();
        }

        return parsePostfix(expr);
    }

    /** Splits {@code name with a, b} style argument text on top-level commas. */
    public List<Expression> parseArguments(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return TextScanner.split(text, ',').stream().map(this::parse).toList();
    }

    private Invocation invocation(String qualifiedName, String arguments) {
        var args = parseArguments(arguments);
        int dot = qualifiedName.indexOf('.');
        if (dot < 0) {
            return new Invocation(qualifiedName, args);
        }
        return new Invocation(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1), args);
    }

    private Optional<Expression> parseFormat(String expr) {
        if (expr.regionMatches(true, 0, "format ", 0, 7)) {
            int as = TextScanner.lastIndexOf(expr, " as ");
            if (as > 7) {
                var pattern = expr.substring(as + 4).trim();
                if (TextScanner.isQuoted(pattern)) {
                    return Optional.of(new FormatExpression(
                            parse(expr.substring(7, as)), TextScanner.unquote(pattern)));
                }
            }
            return Optional.empty();
        }
        Matcher call = FORMAT_CALL.matcher(expr);
        if (call.lookingAt() && TextScanner.matchingClose(expr, call.end() - 1) == expr.length() - 1) {
            var args = TextScanner.split(expr.substring(call.end(), expr.length() - 1), ',');
            if (args.size() != 2 || !TextScanner.isQuoted(args.get(1))) {
                throw new ParseException("Invalid Format expression: " + expr);
            }
            return Optional.of(new FormatExpression(parse(args.get(0)), TextScanner.unquote(args.get(1))));
        }
        return Optional.empty();
    }

    private ArrayLiteral parseArrayLiteral(String content) {
        List<Expression> elements = new ArrayList<>();
        for (var element : TextScanner.split(content, ',')) {
            elements.add(parse(element));
        }
        return new ArrayLiteral(elements);
    }

    private Expression parseString(String quoted) {
        char quote = quoted.charAt(0);
        var content = quoted.substring(1, quoted.length() - 1);
        if (content.indexOf('[') < 0 && !content.contains("${")) {
            return Literal.of(unescape(content, quote));
        }
        return parseInterpolation(content, quote);
    }

    /**
     * Splits {@code "Hello [name]"} or {@code "Hello ${name}"} into literal and expression
     * parts. Empty literal runs are left out.
     */
    StringInterpolation parseInterpolation(String content, char quote) {
        List<Expression> parts = new ArrayList<>();
        var literal = new StringBuilder();
        int i = 0;
        while (i < content.length()) {
            int close;
            int exprStart;
            if (content.startsWith("${", i)) {
                exprStart = i + 2;
                close = content.indexOf('}', exprStart);
            } else if (content.charAt(i) == '[') {
                exprStart = i + 1;
                close = TextScanner.matchingClose(content, i);
            } else {
                literal.append(content.charAt(i++));
                continue;
            }
            if (close < 0) {
                throw new ParseException("Unclosed interpolation in string: " + content);
            }
            if (!literal.isEmpty()) {
                parts.add(Literal.of(unescape(literal.toString(), quote)));
                literal.setLength(0);
            }
            parts.add(parse(content.substring(exprStart, close)));
            i = close + 1;
        }
        if (!literal.isEmpty()) {
            parts.add(Literal.of(unescape(literal.toString(), quote)));
        }
        return new StringInterpolation(parts);
    }

    private static String unescape(String text, char quote) {
        return text.replace("\\" + quote, String.valueOf(quote)).replace("\\\\", "\\");
    }

    private BinaryOp binary(String expr, Split split) {
        var left = expr.substring(0, split.index());
        var right = expr.substring(split.index() + split.operator().image().length());
        if (left.isBlank() || right.isBlank()) {
            throw new ParseException("Missing operand for '" + split.operator().image().trim() + "' in: " + expr);
        }
        return new BinaryOp(parse(left), split.operator().symbol(), parse(right));
    }

    /**
     * Precedence climbing over the additive then the multiplicative level. Each level splits
     * at its right-most top-level operator, which makes the operators left-associative.
     */
    private Optional<Expression> parseArithmetic(String expr) {
        for (var level : List.of(ADDITIVE, MULTIPLICATIVE)) {
            var split = splitLast(expr, level);
            if (split.isPresent()) {
                var operator = split.get().operator();
                var left = expr.substring(0, split.get().index());
                var right = expr.substring(split.get().index() + operator.image().length());
                if (left.isBlank() || right.isBlank()) {
                    throw new ParseException("Missing operand for '" + operator.image().trim() + "' in: " + expr);
                }
                return Optional.of(new ArithmeticOp(parse(left), operator.symbol(), parse(right)));
            }
        }
        if (expr.startsWith("-") && expr.length() > 1) {
            return Optional.of(new ArithmeticOp(Literal.of(0L), "-", parse(expr.substring(1))));
        }
        return Optional.empty();
    }

    /**
     * Identifiers with any chain of {@code .name} and {@code [index]} suffixes, plus the call
     * forms {@code name(args)} and {@code Module.action}.
     */
    private Expression parsePostfix(String expr) {
        var paren = PAREN_CALL.matcher(expr);
        if (paren.lookingAt() && TextScanner.matchingClose(expr, paren.end() - 1) == expr.length() - 1) {
            return invocation(paren.group(1), expr.substring(paren.end(), expr.length() - 1));
        }

        var qualified = QUALIFIED_NAME.matcher(expr);
        if (qualified.matches() && qualified.group(2) != null
                && Character.isUpperCase(qualified.group(1).charAt(0))) {
            return new Invocation(qualified.group(1), qualified.group(2), List.of());
        }

        var head = IDENTIFIER.matcher(expr);
        if (!head.lookingAt()) {
            throw new ParseException("Cannot parse expression: " + expr);
        }
        Expression result = new Identifier(head.group());
        int pos = head.end();
        while (pos < expr.length()) {
            char cur = expr.charAt(pos);
            if (cur == '.') {
                var property = IDENTIFIER.matcher(expr).region(pos + 1, expr.length());
                if (!property.lookingAt()) {
                    throw new ParseException("Expected property name after '.' in: " + expr);
                }
                result = new PropertyAccess(result, property.group());
                pos = property.end();
            } else if (cur == '[') {
                int close = TextScanner.matchingClose(expr, pos);
                if (close < 0) {
                    throw new ParseException("Unclosed '[' in: " + expr);
                }
                result = new ElementAccess(result, parse(expr.substring(pos + 1, close)));
                pos = close + 1;
            } else {
                throw new ParseException("Cannot parse expression: " + expr);
            }
        }
        return result;
    }

    private static String stripEnclosingParentheses(String expr) {
        while (expr.startsWith("(") && TextScanner.matchingClose(expr, 0) == expr.length() - 1) {
            expr = expr.substring(1, expr.length() - 1).trim();
        }
        return expr;
    }

    private static Optional<Split> splitFirst(String expr, List<Operator> operators) {
        for (var operator : operators) {
            int index = TextScanner.indexOf(expr, operator.image());
            if (index >= 0) {
                return Optional.of(new Split(index, operator));
            }
        }
        return Optional.empty();
    }

    /** Right-most top-level occurrence of any of the operators; binary minus only. */
    private static Optional<Split> splitLast(String expr, List<Operator> operators) {
        Split best = null;
        for (var operator : operators) {
            int index = lastBinaryIndex(expr, operator.image());
            if (index >= 0 && (best == null || index > best.index())) {
                best = new Split(index, operator);
            }
        }
        return Optional.ofNullable(best);
    }

    private static int lastBinaryIndex(String expr, String image) {
        var prefix = expr;
        while (true) {
            int index = TextScanner.lastIndexOf(prefix, image);
            if (index < 0) {
                return -1;
            }
            if (!isSymbolicUnaryPosition(expr, index, image) && !isPartOfComparison(expr, index, image)) {
                return index;
            }
            prefix = expr.substring(0, index);
        }
    }

    private static boolean isSymbolicUnaryPosition(String expr, int index, String image) {
        if (!image.equals("-") && !image.equals("+")) {
            return false;
        }
        int prev = index - 1;
        while (prev >= 0 && expr.charAt(prev) == ' ') {
            prev--;
        }
        return prev < 0 || "+-*/%(,<>=!&|".indexOf(expr.charAt(prev)) >= 0;
    }

    private static boolean isPartOfComparison(String expr, int index, String image) {
        return image.equals(" or ") && expr.startsWith(" or equal to ", index);
    }
}
