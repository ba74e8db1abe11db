package com.github.droe.parser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.github.droe.CommentStripper;
import com.github.droe.parser.ParserConfig.BlockStyle;
import com.github.droe.parser.Program.ActionDefinition;
import com.github.droe.parser.Program.Assignment;
import com.github.droe.parser.Program.CollectionKind;
import com.github.droe.parser.Program.DataInstance;
import com.github.droe.parser.Program.DisplayStatement;
import com.github.droe.parser.Program.Expression;
import com.github.droe.parser.Program.FieldAssignment;
import com.github.droe.parser.Program.ForEachLoop;
import com.github.droe.parser.Program.IfStatement;
import com.github.droe.parser.Program.IncludeStatement;
import com.github.droe.parser.Program.Invocation;
import com.github.droe.parser.Program.InvocationStatement;
import com.github.droe.parser.Program.MetadataAnnotation;
import com.github.droe.parser.Program.Parameter;
import com.github.droe.parser.Program.ReturnStatement;
import com.github.droe.parser.Program.ReturnStyle;
import com.github.droe.parser.Program.Statement;
import com.github.droe.parser.Program.TaskDefinition;
import com.github.droe.parser.Program.TypeAnnotation;
import com.github.droe.parser.Program.WhileLoop;

/**
 * Line-based recursive-descent parser. Each logical line is dispatched on its first word;
 * block statements pull their body lines from the shared {@link LineCursor} until the block
 * is closed, either by an {@code end <keyword>} sentinel or, with
 * {@link BlockStyle#INDENTATION}, by a line indented no deeper than the opener.
 */
public class Parser {

    static final Set<String> IF_SENTINELS = Set.of("end if", "end when", "end");
    static final Set<String> WHILE_SENTINELS = Set.of("end while", "end");
    static final Set<String> FOR_SENTINELS = Set.of("end for", "end for each", "end loop", "end");
    static final Set<String> TASK_SENTINELS = Set.of("end task", "end");
    static final Set<String> ACTION_SENTINELS = Set.of("end action", "end");

    private static final Pattern NAME = Pattern.compile("[A-Za-z_]\\w*");
    private static final Pattern NAME_AND_REST = Pattern.compile("([A-Za-z_]\\w*)\\s*(.*)");
    private static final Pattern TYPED = Pattern.compile("(?i)([A-Za-z_]\\w*)\\s+which\\s+(?:is|are)\\s+(.+)");
    private static final Pattern FOR_EACH = Pattern.compile("([A-Za-z_]\\w*)\\s+in\\s+(.+)");
    private static final Pattern INCLUDE_FROM = Pattern.compile("(?i)([A-Za-z_]\\w*)\\s+from\\s+(.+)");
    private static final Pattern PARAMETER = Pattern.compile("(?i)([A-Za-z_]\\w*)\\s+which\\s+(?:is|are)\\s+(.+)");

    private final ParserConfig config;
    private final ExpressionParser expressions = new ExpressionParser();
    private final StructureParser structures = new StructureParser(this);

    public Parser() {
        this(ParserConfig.defaults());
    }

    public Parser(ParserConfig config) {
        this.config = config;
    }

    public ParserConfig config() {
        return config;
    }

    public Program parse(String source) {
        var lines = new LineCursor(new CommentStripper(config.hashComments()).stripLines(source));

        List<Statement> statements = new ArrayList<>();
        List<MetadataAnnotation> metadata = new ArrayList<>();
        List<IncludeStatement> includes = new ArrayList<>();

        while (lines.skipBlank()) {
            int indent = lines.indentation();
            int line = lines.lineNumber();
            var text = lines.next().trim();
            if (text.startsWith("@")) {
                metadata.add(structures.parseMetadata(text, line));
                continue;
            }
            var statement = parseStatement(text, line, indent, lines);
            if (statement == null) {
                continue;
            }
            statements.add(statement);
            if (statement instanceof IncludeStatement include) {
                includes.add(include);
            }
        }
        return new Program(statements, metadata, includes);
    }

    /**
     * Parses the statement starting with {@code text}; block statements consume further lines.
     * Returns {@code null} for lines that produce no statement.
     */
    Statement parseStatement(String text, int line, int indent, LineCursor lines) {
        try {
            return dispatch(text, line, indent, lines);
        } catch (ParseException e) {
            if (e.getLineNumber() < 0) {
                throw new ParseException(line, e.getDetail());
            }
            throw e;
        }
    }

    private Statement dispatch(String text, int line, int indent, LineCursor lines) {
        var header = stripColon(text);
        var keyword = firstWord(header).toLowerCase(Locale.ROOT);
        var rest = header.substring(firstWord(header).length()).trim();

        switch (keyword) {
            case "display", "show":
                return new DisplayStatement(expressions.parse(require(rest, keyword)), line);
            case "if", "when":
                return parseIf(rest, line, indent, lines);
            case "set":
                return parseAssignment(require(rest, keyword), line);
            case "while":
                return new WhileLoop(expressions.parse(require(stripTrailingWord(rest, "do"), keyword)),
                        parseBody(lines, indent, line, "while", WHILE_SENTINELS), line);
            case "for":
                if (!rest.toLowerCase(Locale.ROOT).startsWith("each ")) {
                    throw new ParseException("Expected 'for each <item> in <collection>'");
                }
                return parseForEach(rest.substring(5).trim(), line, indent, lines);
            case "loop":
                return parseForEach(rest, line, indent, lines);
            case "task":
                return parseTask(require(rest, keyword), line, indent, lines);
            case "action":
                return parseAction(require(rest, keyword), line, indent, lines);
            case "module":
                return structures.parseModule(require(rest, keyword), line, indent, lines);
            case "data":
                return structures.parseData(require(rest, keyword), line, indent, lines);
            case "layout", "form":
                return structures.parseContainer(keyword, rest, line, indent, lines);
            case "respond":
                return parseReturn(header, "respond with", ReturnStyle.RESPOND_WITH, line);
            case "answer":
                return parseReturn(header, "answer is", ReturnStyle.ANSWER_IS, line);
            case "output":
                return parseReturn(header, "output", ReturnStyle.OUTPUT, line);
            case "give", "return":
                return parseReturn(header, keyword, ReturnStyle.GIVE, line);
            case "include":
                return parseInclude(require(rest, keyword), line);
            case "end":
                if (config.blockStyle() == BlockStyle.SENTINEL) {
                    throw new ParseException("Unexpected '" + header + "' without an open block");
                }
                return null;
            default:
                break;
        }

        var widget = StructureParser.widgetKind(keyword);
        if (widget.isPresent()) {
            return structures.parseWidget(widget.get(), rest, line, indent, lines);
        }
        return parseFallback(header, line);
    }

    // <> if <cond> then <stmt> [otherwise <stmt>]
    // <> if <cond> [then] <body> [otherwise [if <cond>] <body>] end if
    private IfStatement parseIf(String rest, int line, int indent, LineCursor lines) {
        return parseIf(rest, line, indent, lines, false);
    }

    /**
     * @param chained whether this is the {@code if} of an {@code otherwise if} branch, which
     *        leaves the enclosing block open even in its single-line form
     */
    private IfStatement parseIf(String rest, int line, int indent, LineCursor lines, boolean chained) {
        var conditionText = require(rest, "if");
        String inline = null;
        int then = TextScanner.indexOf(conditionText, " then ");
        if (then >= 0) {
            inline = conditionText.substring(then + 6).trim();
            conditionText = conditionText.substring(0, then);
        } else {
            conditionText = stripTrailingWord(conditionText, "then");
        }
        var condition = expressions.parse(conditionText);

        if (inline != null && !inline.isEmpty()) {
            var otherwise = firstOf(inline, " otherwise ", " else ");
            if (otherwise.isPresent()) {
                int at = otherwise.get();
                var elseText = inline.substring(inline.indexOf(' ', at + 1) + 1).trim();
                return new IfStatement(condition,
                        List.of(inlineStatement(inline.substring(0, at).trim(), line, indent, lines)),
                        Optional.of(List.of(inlineStatement(elseText, line, indent, lines))), line);
            }
            var thenBody = List.of(inlineStatement(inline, line, indent, lines));
            if (!chained) {
                return new IfStatement(condition, thenBody, Optional.empty(), line);
            }
            var block = parseBlock(lines, indent, line, "if", IF_SENTINELS, true);
            if (!block.body().isEmpty()) {
                throw new ParseException(block.body().get(0).line(),
                        "Only 'otherwise' or 'end if' may follow a single-line 'otherwise if'");
            }
            return new IfStatement(condition, thenBody, elseBranch(block, line, indent, lines), line);
        }

        var block = parseBlock(lines, indent, line, "if", IF_SENTINELS, true);
        return new IfStatement(condition, block.body(), elseBranch(block, line, indent, lines), line);
    }

    /** The else body opened by {@code block}'s branch line, if it ended at one. */
    private Optional<List<Statement>> elseBranch(Block block, int line, int indent, LineCursor lines) {
        if (block.branch() == null) {
            return Optional.empty();
        }
        var branch = stripColon(block.branch());
        var afterKeyword = branch.substring(firstWord(branch).length()).trim();
        var nestedKeyword = firstWord(afterKeyword).toLowerCase(Locale.ROOT);
        if (nestedKeyword.equals("if") || nestedKeyword.equals("when")) {
            var nested = parseIf(afterKeyword.substring(nestedKeyword.length()).trim(),
                    block.branchLine(), indent, lines, true);
            return Optional.of(List.of(nested));
        }

        List<Statement> body = new ArrayList<>();
        if (!afterKeyword.isEmpty()) {
            body.add(inlineStatement(afterKeyword, block.branchLine(), indent, lines));
        }
        body.addAll(parseBlock(lines, indent, line, "if", IF_SENTINELS, false).body());
        return Optional.of(body);
    }

    private Statement inlineStatement(String text, int line, int indent, LineCursor lines) {
        var statement = parseStatement(text, line, indent, lines);
        if (statement == null) {
            throw new ParseException(line, "Expected a statement after 'then'");
        }
        return statement;
    }

    private ForEachLoop parseForEach(String rest, int line, int indent, LineCursor lines) {
        var matcher = FOR_EACH.matcher(stripTrailingWord(rest, "do"));
        if (!matcher.matches()) {
            throw new ParseException("Expected '<item> in <collection>' after 'for each'");
        }
        var iterable = expressions.parse(matcher.group(2));
        return new ForEachLoop(matcher.group(1), iterable,
                parseBody(lines, indent, line, "for", FOR_SENTINELS), line);
    }

    // <> set v which is <type> (to|=) <expr>
    // <> set v which is <type> from <invocation>
    // <> set v which is <DataType> with f is <expr>, ...
    Assignment parseAssignment(String rest, int line) {
        var typed = TYPED.matcher(rest);
        if (!typed.matches()) {
            var name = NAME_AND_REST.matcher(rest);
            var variable = name.matches() ? name.group(1) : rest;
            throw new ParseException("Variable '" + variable + "' must declare a type, e.g. 'set "
                    + variable + " which is int to 0'");
        }
        var variable = typed.group(1);
        var tail = typed.group(2);

        var splits = new int[] {
                TextScanner.indexOf(tail, " to "),
                TextScanner.indexOf(tail, " from "),
                TextScanner.indexOf(tail, " = "),
                TextScanner.indexOf(tail, " with ") };
        int kind = -1;
        for (int i = 0; i < splits.length; i++) {
            if (splits[i] >= 0 && (kind < 0 || splits[i] < splits[kind])) {
                kind = i;
            }
        }
        if (kind < 0) {
            throw new ParseException("Missing value for '" + variable + "'");
        }

        var type = parseType(tail.substring(0, splits[kind]));
        var valueText = tail.substring(splits[kind]).trim();
        valueText = valueText.substring(valueText.indexOf(' ') + 1).trim();
        if (valueText.isEmpty()) {
            throw new ParseException("Missing value for '" + variable + "'");
        }

        return switch (kind) {
            case 1 -> new Assignment(variable, expressions.parse(valueText), Optional.of(type), true, line);
            case 3 -> new Assignment(variable, parseDataInstance(type, valueText), Optional.of(type), false, line);
            default -> new Assignment(variable, expressions.parse(valueText), Optional.of(type), false, line);
        };
    }

    private DataInstance parseDataInstance(TypeAnnotation type, String fieldsText) {
        if (type.collectionKind().isPresent()) {
            throw new ParseException("A collection type cannot be built with 'with': " + type.describe());
        }
        List<FieldAssignment> fields = new ArrayList<>();
        for (var field : TextScanner.split(fieldsText, ',')) {
            int is = TextScanner.indexOf(field, " is ");
            if (is < 0 || !NAME.matcher(field.substring(0, is).trim()).matches()) {
                throw new ParseException("Expected '<field> is <value>' but got: " + field);
            }
            fields.add(new FieldAssignment(field.substring(0, is).trim(),
                    expressions.parse(field.substring(is + 4))));
        }
        return new DataInstance(type.typeName(), fields);
    }

    /** {@code int}, {@code Person}, {@code list of text} or {@code group of int}. */
    TypeAnnotation parseType(String text) {
        var words = text.trim().split("\\s+");
        if (words.length == 3 && words[1].equalsIgnoreCase("of")) {
            var kind = switch (words[0].toLowerCase(Locale.ROOT)) {
                case "list" -> CollectionKind.LIST;
                case "group" -> CollectionKind.GROUP;
                default -> throw new ParseException("Unknown collection type: " + text.trim());
            };
            requireName(words[2], "type");
            return new TypeAnnotation(words[2], kind);
        }
        if (words.length != 1 || words[0].isEmpty()) {
            throw new ParseException("Invalid type: '" + text.trim() + "'");
        }
        requireName(words[0], "type");
        return new TypeAnnotation(words[0]);
    }

    // <> task name [with p which is t, ...] <body> end task
    private TaskDefinition parseTask(String rest, int line, int indent, LineCursor lines) {
        var signature = parseSignature(rest, "task");
        return new TaskDefinition(signature.name(), signature.parameters(),
                parseBody(lines, indent, line, "task", TASK_SENTINELS), line);
    }

    // <> action name [with p which is t and ...] gives <type> <body> end action
    private ActionDefinition parseAction(String rest, int line, int indent, LineCursor lines) {
        int gives = TextScanner.lastIndexOf(" " + rest, " gives ");
        if (gives < 0) {
            var name = NAME_AND_REST.matcher(rest);
            throw new ParseException("Action '" + (name.matches() ? name.group(1) : rest)
                    + "' must declare a return type with 'gives <type>'");
        }
        var returnType = parseType(rest.substring(gives + 6));
        var signature = parseSignature(rest.substring(0, Math.max(0, gives - 1)), "action");
        return new ActionDefinition(signature.name(), signature.parameters(), Optional.of(returnType),
                parseBody(lines, indent, line, "action", ACTION_SENTINELS), line);
    }

    private record Signature(String name, List<Parameter> parameters) {}

    private Signature parseSignature(String text, String what) {
        var trimmed = text.trim();
        int paren = trimmed.indexOf('(');
        if (paren > 0 && TextScanner.matchingClose(trimmed, paren) == trimmed.length() - 1) {
            var name = requireName(trimmed.substring(0, paren).trim(), what + " name");
            return new Signature(name, parseParameters(trimmed.substring(paren + 1, trimmed.length() - 1)));
        }
        var matcher = NAME_AND_REST.matcher(trimmed);
        if (!matcher.matches()) {
            throw new ParseException("Invalid " + what + " name: '" + trimmed + "'");
        }
        var tail = matcher.group(2);
        if (tail.isEmpty()) {
            return new Signature(matcher.group(1), List.of());
        }
        if (!tail.toLowerCase(Locale.ROOT).startsWith("with ")) {
            throw new ParseException("Expected 'with' after " + what + " name but got: " + tail);
        }
        return new Signature(matcher.group(1), parseParameters(tail.substring(5)));
    }

    /** Parameters separated by {@code ,} or {@code and}. */
    List<Parameter> parseParameters(String text) {
        List<Parameter> parameters = new ArrayList<>();
        for (var part : TextScanner.split(text, ',')) {
            for (var single : part.split("\\s+and\\s+")) {
                var matcher = PARAMETER.matcher(single.trim());
                if (!matcher.matches()) {
                    throw new ParseException("Parameter must declare a type: '" + single.trim() + "'");
                }
                parameters.add(new Parameter(matcher.group(1), parseType(matcher.group(2))));
            }
        }
        return parameters;
    }

    private ReturnStatement parseReturn(String header, String keyword, ReturnStyle style, int line) {
        if (!header.toLowerCase(Locale.ROOT).startsWith(keyword + " ")) {
            throw new ParseException("Expected an expression after '" + keyword + "'");
        }
        return new ReturnStatement(expressions.parse(header.substring(keyword.length())), style, line);
    }

    // <> include Name from "path"
    // <> include "path"
    private IncludeStatement parseInclude(String rest, int line) {
        var from = INCLUDE_FROM.matcher(rest);
        if (from.matches()) {
            return new IncludeStatement(from.group(1), TextScanner.unquote(from.group(2).trim()), line);
        }
        var path = TextScanner.unquote(rest);
        if (path.isBlank()) {
            throw new ParseException("Include needs a file path");
        }
        var fileName = Path.of(path).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return new IncludeStatement(dot > 0 ? fileName.substring(0, dot) : fileName, path, line);
    }

    private Statement parseFallback(String text, int line) {
        if (TYPED.matcher(text).matches()) {
            return parseAssignment(text, line);
        }
        int assign = assignmentIndex(text);
        if (assign > 0) {
            var variable = text.substring(0, assign).trim();
            throw new ParseException("Variable '" + variable + "' must declare a type, e.g. '"
                    + variable + " which is int = 0'");
        }
        Expression expression;
        try {
            expression = expressions.parse(text);
        } catch (ParseException e) {
            throw new ParseException("Unknown statement: " + text + " (" + e.getDetail() + ")");
        }
        if (expression instanceof Invocation invocation) {
            return new InvocationStatement(invocation, line);
        }
        throw new ParseException("Unknown statement: " + text);
    }

    /** Index of a lone top-level {@code =}, or -1. */
    private static int assignmentIndex(String text) {
        int from = 0;
        while (true) {
            int index = TextScanner.indexOf(text, "=", from);
            if (index < 0) {
                return -1;
            }
            char before = index > 0 ? text.charAt(index - 1) : ' ';
            char after = index + 1 < text.length() ? text.charAt(index + 1) : ' ';
            if ("=!<>".indexOf(before) < 0 && after != '=') {
                return index;
            }
            from = index + 2;
        }
    }

    // blocks

    record Block(List<Statement> body, String branch, int branchLine) {}

    List<Statement> parseBody(LineCursor lines, int indent, int line, String opener, Set<String> sentinels) {
        return parseBlock(lines, indent, line, opener, sentinels, false).body();
    }

    /**
     * Collects statements until the block closes. With {@code allowBranch}, an
     * {@code otherwise}/{@code else} line also closes it and is reported in
     * {@link Block#branch()}.
     */
    Block parseBlock(LineCursor lines, int openerIndent, int openerLine, String opener,
            Set<String> sentinels, boolean allowBranch) {
        List<Statement> body = new ArrayList<>();
        boolean indentation = config.blockStyle() == BlockStyle.INDENTATION;

        while (lines.skipBlank()) {
            int indent = lines.indentation();
            int line = lines.lineNumber();
            var text = lines.peek().trim();
            var lower = stripColon(text).toLowerCase(Locale.ROOT);

            if (sentinels.contains(lower)) {
                lines.next();
                return new Block(body, null, 0);
            }
            if (allowBranch && isBranch(lower) && (!indentation || indent <= openerIndent)) {
                lines.next();
                return new Block(body, text, line);
            }
            if (indentation && indent <= openerIndent) {
                return new Block(body, null, 0);
            }

            lines.next();
            if (text.startsWith("@")) {
                throw new ParseException(line, "Metadata annotations are only allowed at top level");
            }
            var statement = parseStatement(text, line, indent, lines);
            if (statement != null) {
                body.add(statement);
            }
        }

        if (!indentation) {
            throw new ParseException(openerLine, "Missing 'end " + opener + "' for block");
        }
        return new Block(body, null, 0);
    }

    private static boolean isBranch(String lower) {
        return lower.equals("otherwise") || lower.equals("else")
                || lower.startsWith("otherwise ") || lower.startsWith("else ");
    }

    // helpers

    private static Optional<Integer> firstOf(String text, String... needles) {
        int best = -1;
        for (var needle : needles) {
            int index = TextScanner.indexOf(text, needle);
            if (index >= 0 && (best < 0 || index < best)) {
                best = index;
            }
        }
        return best < 0 ? Optional.empty() : Optional.of(best);
    }

    static String firstWord(String text) {
        int space = 0;
        while (space < text.length() && !Character.isWhitespace(text.charAt(space))) {
            space++;
        }
        return text.substring(0, space);
    }

    static String stripColon(String text) {
        return text.endsWith(":") ? text.substring(0, text.length() - 1).trim() : text;
    }

    private static String stripTrailingWord(String text, String word) {
        var lower = text.toLowerCase(Locale.ROOT);
        if (lower.endsWith(" " + word)) {
            return text.substring(0, text.length() - word.length()).trim();
        }
        return text;
    }

    static String require(String rest, String keyword) {
        if (rest.isEmpty()) {
            throw new ParseException("'" + keyword + "' needs more input");
        }
        return rest;
    }

    static String requireName(String text, String what) {
        if (!NAME.matcher(text).matches()) {
            throw new ParseException("Invalid " + what + ": '" + text + "'");
        }
        return text;
    }
}
