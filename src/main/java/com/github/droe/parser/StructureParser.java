package com.github.droe.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.github.droe.parser.ParserConfig.BlockStyle;
import com.github.droe.parser.Program.ActionTrigger;
import com.github.droe.parser.Program.Attribute;
import com.github.droe.parser.Program.Binding;
import com.github.droe.parser.Program.Container;
import com.github.droe.parser.Program.ContainerKind;
import com.github.droe.parser.Program.DataDefinition;
import com.github.droe.parser.Program.DataField;
import com.github.droe.parser.Program.FieldAnnotation;
import com.github.droe.parser.Program.MetadataAnnotation;
import com.github.droe.parser.Program.ModuleDefinition;
import com.github.droe.parser.Program.Property;
import com.github.droe.parser.Program.Validation;
import com.github.droe.parser.Program.Widget;
import com.github.droe.parser.Program.WidgetKind;

import lombok.RequiredArgsConstructor;

/**
 * Declarative forms: modules, data definitions, layouts, forms, UI widgets and metadata
 * annotations. Bodies are read through the owning {@link Parser} so they may nest any
 * statement.
 */
@RequiredArgsConstructor
class StructureParser {

    static final Set<String> MODULE_SENTINELS = Set.of("end module", "end");
    static final Set<String> DATA_SENTINELS = Set.of("end data", "end");
    static final Set<String> LAYOUT_SENTINELS = Set.of("end layout", "end");
    static final Set<String> FORM_SENTINELS = Set.of("end form", "end");
    // the option block is optional, so a bare "end" belongs to the enclosing block
    static final Set<String> DROPDOWN_SENTINELS = Set.of("end dropdown");

    /** Attributes followed by a value token. */
    static final Set<String> VALUE_ATTRIBUTES = Set.of(
            "id", "bind", "validate", "class", "action", "placeholder", "type", "rows", "default",
            "group", "source", "alt");

    /** Attributes that stand alone and mean {@code true}. */
    static final Set<String> FLAG_ATTRIBUTES = Set.of("controls", "autoplay", "loop", "muted");

    /** Widgets whose first quoted token is their caption. */
    static final Set<WidgetKind> CAPTIONED = EnumSet.of(
            WidgetKind.TITLE, WidgetKind.TEXT, WidgetKind.TOGGLE, WidgetKind.CHECKBOX,
            WidgetKind.RADIO, WidgetKind.BUTTON);

    private static final Pattern METADATA_CALL = Pattern.compile("@(\\w+)\\((.*)\\)");
    private static final Pattern METADATA_SIMPLE = Pattern.compile("@(\\w+)(?:\\s+(.+))?");
    private static final Pattern METADATA_PARAMETER = Pattern.compile("(\\w+)\\s*=\\s*(\"[^\"]*\"|'[^']*')");

    private final Parser parser;

    static Optional<WidgetKind> widgetKind(String keyword) {
        return Arrays.stream(WidgetKind.values())
                .filter(k -> k.keyword().equals(keyword))
                .findFirst();
    }

    // <> module Name <statements> end module
    ModuleDefinition parseModule(String rest, int line, int indent, LineCursor lines) {
        var name = Parser.requireName(rest, "module name");
        return new ModuleDefinition(name, parser.parseBody(lines, indent, line, "module", MODULE_SENTINELS), line);
    }

    // <> data Name [<field> is <type> [annotation]*]* end data
    DataDefinition parseData(String rest, int line, int indent, LineCursor lines) {
        var name = Parser.requireName(rest, "data name");
        boolean indentation = parser.config().blockStyle() == BlockStyle.INDENTATION;
        List<DataField> fields = new ArrayList<>();

        while (lines.skipBlank()) {
            var text = lines.peek().trim();
            if (DATA_SENTINELS.contains(text.toLowerCase(Locale.ROOT))) {
                lines.next();
                return new DataDefinition(name, fields, line);
            }
            if (indentation && lines.indentation() <= indent) {
                return new DataDefinition(name, fields, line);
            }
            int fieldLine = lines.lineNumber();
            lines.next();
            try {
                fields.add(parseField(text));
            } catch (ParseException e) {
                throw new ParseException(fieldLine, e.getDetail());
            }
        }

        if (indentation) {
            return new DataDefinition(name, fields, line);
        }
        throw new ParseException(line, "Missing 'end data' for block");
    }

    private DataField parseField(String text) {
        int is = text.indexOf(" is ");
        if (is < 0) {
            throw new ParseException("Expected '<field> is <type>' but got: " + text);
        }
        var name = Parser.requireName(text.substring(0, is).trim(), "field name");
        var words = text.substring(is + 4).trim().split("\\s+");

        int typeWords = words.length >= 3 && words[1].equalsIgnoreCase("of") ? 3 : 1;
        var type = parser.parseType(String.join(" ", Arrays.copyOfRange(words, 0, typeWords)));

        var annotations = EnumSet.noneOf(FieldAnnotation.class);
        for (int i = typeWords; i < words.length; i++) {
            try {
                annotations.add(FieldAnnotation.valueOf(words[i].toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ParseException("Unknown field annotation '" + words[i] + "' on field '" + name + "'");
            }
        }
        return new DataField(name, type, annotations);
    }

    // <> layout|form [Name] [attribute]* <children> end layout|form
    Container parseContainer(String keyword, String rest, int line, int indent, LineCursor lines) {
        var kind = keyword.equals("form") ? ContainerKind.FORM : ContainerKind.LAYOUT;
        var tokens = TextScanner.tokenize(rest);

        String name = "";
        if (!tokens.isEmpty() && !isAttributeKeyword(tokens.get(0))) {
            name = TextScanner.unquote(tokens.get(0));
            tokens = tokens.subList(1, tokens.size());
        }
        var attributes = new Attributes(keyword);
        attributes.read(tokens, null);

        var sentinels = kind == ContainerKind.FORM ? FORM_SENTINELS : LAYOUT_SENTINELS;
        var children = parser.parseBody(lines, indent, line, keyword, sentinels);
        return new Container(name, kind, children, attributes.attributes, attributes.cssClasses, line);
    }

    /**
     * A single widget line, e.g. {@code input id email type email bind user.email validate email}.
     * A dropdown may be followed by {@code option "<text>"} lines and an {@code end dropdown}.
     */
    Widget parseWidget(WidgetKind kind, String rest, int line, int indent, LineCursor lines) {
        var attributes = new Attributes(kind.keyword());
        var caption = attributes.read(TextScanner.tokenize(rest), kind);

        if (kind == WidgetKind.INPUT && attributes.property("type").isEmpty()) {
            attributes.attributes.add(new Property("type", "text"));
        }
        if (kind == WidgetKind.TEXTAREA && attributes.property("rows").isEmpty()) {
            attributes.attributes.add(new Property("rows", "4"));
        }

        List<String> options = kind == WidgetKind.DROPDOWN ? parseOptions(lines) : List.of();
        return new Widget(kind, caption, Optional.ofNullable(attributes.elementId),
                attributes.attributes, attributes.cssClasses, options, line);
    }

    private List<String> parseOptions(LineCursor lines) {
        List<String> options = new ArrayList<>();
        while (lines.skipBlank()) {
            var text = lines.peek().trim();
            if (text.toLowerCase(Locale.ROOT).startsWith("option ")) {
                int line = lines.lineNumber();
                lines.next();
                var value = text.substring(7).trim();
                if (value.isEmpty()) {
                    throw new ParseException(line, "Option needs a value");
                }
                options.add(TextScanner.unquote(value));
            } else {
                if (DROPDOWN_SENTINELS.contains(text.toLowerCase(Locale.ROOT))) {
                    lines.next();
                }
                break;
            }
        }
        return options;
    }

    private static boolean isAttributeKeyword(String token) {
        var lower = token.toLowerCase(Locale.ROOT);
        return VALUE_ATTRIBUTES.contains(lower) || FLAG_ATTRIBUTES.contains(lower) || token.contains("=");
    }

    /** Collects attribute tokens of one component line in source order. */
    private static class Attributes {
        private final String owner;
        private final List<Attribute> attributes = new ArrayList<>();
        private final List<String> cssClasses = new ArrayList<>();
        private String elementId;

        Attributes(String owner) {
            this.owner = owner;
        }

        /** Returns the caption if {@code kind} takes one and the tokens provide it. */
        Optional<String> read(List<String> tokens, WidgetKind kind) {
            String caption = null;
            int i = 0;
            while (i < tokens.size()) {
                var token = tokens.get(i);
                var lower = token.toLowerCase(Locale.ROOT);
                int equals = token.indexOf('=');

                if (VALUE_ATTRIBUTES.contains(lower) && i + 1 < tokens.size()) {
                    add(lower, tokens.get(i + 1));
                    i += 2;
                } else if (FLAG_ATTRIBUTES.contains(lower)) {
                    attributes.add(new Property(lower, "true"));
                    i++;
                } else if (equals > 0 && !TextScanner.isQuoted(token)) {
                    add(token.substring(0, equals).toLowerCase(Locale.ROOT), token.substring(equals + 1));
                    i++;
                } else if (kind != null && CAPTIONED.contains(kind) && caption == null) {
                    caption = TextScanner.unquote(token);
                    i++;
                } else {
                    throw new ParseException("Unexpected '" + token + "' in " + owner);
                }
            }
            return Optional.ofNullable(caption);
        }

        private void add(String name, String rawValue) {
            var value = TextScanner.unquote(rawValue);
            switch (name) {
                case "id" -> elementId = value;
                case "bind" -> attributes.add(new Binding(value));
                case "validate" -> attributes.add(new Validation(value));
                case "action" -> attributes.add(new ActionTrigger(value));
                case "class" -> cssClasses.addAll(Arrays.asList(value.trim().split("\\s+")));
                default -> attributes.add(new Property(name, value));
            }
        }

        Optional<String> property(String name) {
            return attributes.stream()
                    .filter(a -> a instanceof Property p && p.name().equals(name))
                    .map(a -> ((Property) a).value())
                    .findFirst();
        }
    }

    // <> @key value | @key "value" | @key(k1="v1", k2='v2')
    MetadataAnnotation parseMetadata(String text, int line) {
        var call = METADATA_CALL.matcher(text);
        if (call.matches()) {
            Map<String, String> parameters = new LinkedHashMap<>();
            var parameter = METADATA_PARAMETER.matcher(call.group(2));
            while (parameter.find()) {
                parameters.put(parameter.group(1), TextScanner.unquote(parameter.group(2)));
            }
            return new MetadataAnnotation(call.group(1), "", parameters);
        }
        var simple = METADATA_SIMPLE.matcher(text);
        if (simple.matches()) {
            var value = simple.group(2) == null ? "" : TextScanner.unquote(simple.group(2).trim());
            return new MetadataAnnotation(simple.group(1), value);
        }
        throw new ParseException(line, "Invalid metadata annotation: " + text);
    }
}
