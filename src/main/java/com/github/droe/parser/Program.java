package com.github.droe.parser;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Root of the syntax tree and the closed set of node shapes below it. Every child list keeps
 * source order. Statements remember the 1-based line they started on; expressions do not, so
 * that equal source fragments give equal expressions wherever they appear.
 */
public record Program(
        List<Statement> statements,
        List<MetadataAnnotation> metadata,
        List<IncludeStatement> includes) {

    public Program(List<Statement> statements) {
        this(statements, List.of(), List.of());
    }

    public Program(List<Statement> statements, List<MetadataAnnotation> metadata) {
        this(statements, metadata, List.of());
    }

    /**
     * First annotation with the given key. Keys are unique only by convention.
     */
    public Optional<MetadataAnnotation> metadata(String key) {
        return metadata.stream().filter(m -> m.key().equals(key)).findFirst();
    }

    public record MetadataAnnotation(String key, String value, Map<String, String> parameters) {
        public MetadataAnnotation(String key, String value) {
            this(key, value, Map.of());
        }
    }

    // expressions

    public sealed interface Expression
            permits Literal, Identifier, PropertyAccess, ElementAccess, BinaryOp, ArithmeticOp,
            ArrayLiteral, StringInterpolation, FormatExpression, Invocation, DataInstance {}

    public enum LiteralType { STRING, NUMBER, BOOLEAN }

    /**
     * Value is a {@code String}, {@code Long}, {@code Double} or {@code Boolean}; numbers are
     * integral exactly when the value is a {@code Long}.
     */
    public record Literal(Object value, LiteralType type) implements Expression {
        public static Literal of(String value) {
            return new Literal(value, LiteralType.STRING);
        }
        public static Literal of(long value) {
            return new Literal(value, LiteralType.NUMBER);
        }
        public static Literal of(double value) {
            return new Literal(value, LiteralType.NUMBER);
        }
        public static Literal of(boolean value) {
            return new Literal(value, LiteralType.BOOLEAN);
        }
        public boolean isInteger() {
            return value instanceof Long;
        }
    }

    public record Identifier(String name) implements Expression {}
    public record PropertyAccess(Expression target, String property) implements Expression {}
    public record ElementAccess(Expression target, Expression index) implements Expression {}

    /** Comparison ({@code == != < > <= >=}) or logical ({@code && ||}) operation. */
    public record BinaryOp(Expression left, String operator, Expression right) implements Expression {}

    /** {@code + - * / %} */
    public record ArithmeticOp(Expression left, String operator, Expression right) implements Expression {}

    public record ArrayLiteral(List<Expression> elements) implements Expression {}

    /** Alternating text literals and embedded expressions, in source order. */
    public record StringInterpolation(List<Expression> parts) implements Expression {}

    public record FormatExpression(Expression expression, String pattern) implements Expression {}

    /**
     * Call of an action or task, optionally qualified with the module that defines it.
     */
    public record Invocation(Optional<String> module, String name, List<Expression> arguments) implements Expression {
        public Invocation(String name, List<Expression> arguments) {
            this(Optional.empty(), name, arguments);
        }
        public Invocation(String module, String name, List<Expression> arguments) {
            this(Optional.of(module), name, arguments);
        }
        public String qualifiedName() {
            return module.map(m -> m + "." + name).orElse(name);
        }
    }

    public record DataInstance(String typeName, List<FieldAssignment> fields) implements Expression {}
    public record FieldAssignment(String field, Expression value) {}

    // types as written in source

    public enum CollectionKind { LIST, GROUP }

    /**
     * A type as written after {@code which is}, {@code gives} or in a data field, e.g.
     * {@code int} or {@code list of text}.
     */
    public record TypeAnnotation(String typeName, Optional<CollectionKind> collectionKind) {
        public TypeAnnotation(String typeName) {
            this(typeName, Optional.empty());
        }
        public TypeAnnotation(String typeName, CollectionKind collectionKind) {
            this(typeName, Optional.of(collectionKind));
        }
        public String describe() {
            return collectionKind
                    .map(k -> (k == CollectionKind.LIST ? "list of " : "group of ") + typeName)
                    .orElse(typeName);
        }
    }

    public record Parameter(String name, TypeAnnotation type) {}

    // statements

    public sealed interface Statement
            permits DisplayStatement, Assignment, IfStatement, WhileLoop, ForEachLoop, ReturnStatement,
            IncludeStatement, InvocationStatement, Declaration, Component {
        int line();
    }

    public record DisplayStatement(Expression expression, int line) implements Statement {}

    /**
     * {@code actionResult} marks the {@code set v which is t from action ...} binding form.
     */
    public record Assignment(
            String variable,
            Expression value,
            Optional<TypeAnnotation> declaredType,
            boolean actionResult,
            int line) implements Statement {
        public Optional<CollectionKind> collectionKind() {
            return declaredType.flatMap(TypeAnnotation::collectionKind);
        }
    }

    public record IfStatement(
            Expression condition,
            List<Statement> thenBody,
            Optional<List<Statement>> elseBody,
            int line) implements Statement {}

    public record WhileLoop(Expression condition, List<Statement> body, int line) implements Statement {}

    public record ForEachLoop(String variable, Expression iterable, List<Statement> body, int line) implements Statement {}

    public enum ReturnStyle {
        RESPOND_WITH("respond with"), ANSWER_IS("answer is"), OUTPUT("output"), GIVE("give");

        private final String keyword;

        ReturnStyle(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public record ReturnStatement(Expression expression, ReturnStyle style, int line) implements Statement {}

    public record IncludeStatement(String moduleName, String filePath, int line) implements Statement {}

    public record InvocationStatement(Invocation invocation, int line) implements Statement {}

    // declarations

    public sealed interface Declaration extends Statement
            permits TaskDefinition, ActionDefinition, ModuleDefinition, DataDefinition {
        String name();
    }

    public record TaskDefinition(String name, List<Parameter> parameters, List<Statement> body, int line) implements Declaration {}

    public record ActionDefinition(
            String name,
            List<Parameter> parameters,
            Optional<TypeAnnotation> returnType,
            List<Statement> body,
            int line) implements Declaration {}

    public record ModuleDefinition(String name, List<Statement> body, int line) implements Declaration {}

    public enum FieldAnnotation { REQUIRED, UNIQUE, KEY, AUTO, OPTIONAL }

    public record DataField(String name, TypeAnnotation type, Set<FieldAnnotation> annotations) {}

    public record DataDefinition(String name, List<DataField> fields, int line) implements Declaration {}

    // user interface

    public sealed interface Component extends Statement permits Container, Widget {
        List<Attribute> attributes();
        List<String> cssClasses();

        default Optional<String> attribute(String name) {
            return attributes().stream()
                    .filter(a -> a instanceof Property p && p.name().equals(name))
                    .map(a -> ((Property) a).value())
                    .findFirst();
        }
        default Optional<String> binding() {
            return attributes().stream()
                    .filter(Binding.class::isInstance)
                    .map(a -> ((Binding) a).target())
                    .findFirst();
        }
    }

    public enum ContainerKind { LAYOUT, FORM }

    public record Container(
            String name,
            ContainerKind kind,
            List<Statement> children,
            List<Attribute> attributes,
            List<String> cssClasses,
            int line) implements Component {}

    public enum WidgetKind {
        TITLE, TEXT, INPUT, TEXTAREA, DROPDOWN, TOGGLE, CHECKBOX, RADIO, BUTTON, IMAGE, VIDEO, AUDIO;

        public String keyword() {
            return name().toLowerCase();
        }
    }

    /**
     * A leaf component. {@code text} is the caption (title, text, checkbox, radio, toggle and
     * button); {@code options} is only filled for dropdowns.
     */
    public record Widget(
            WidgetKind kind,
            Optional<String> text,
            Optional<String> elementId,
            List<Attribute> attributes,
            List<String> cssClasses,
            List<String> options,
            int line) implements Component {
        public Optional<String> action() {
            return attributes.stream()
                    .filter(ActionTrigger.class::isInstance)
                    .map(a -> ((ActionTrigger) a).action())
                    .findFirst();
        }
    }

    public sealed interface Attribute permits Validation, Binding, ActionTrigger, Property {}
    public record Validation(String rule) implements Attribute {}
    public record Binding(String target) implements Attribute {}
    public record ActionTrigger(String action) implements Attribute {}
    public record Property(String name, String value) implements Attribute {}
}
