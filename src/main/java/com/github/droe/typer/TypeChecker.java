package com.github.droe.typer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.droe.parser.Program;
import com.github.droe.parser.Program.ActionDefinition;
import com.github.droe.parser.Program.ArithmeticOp;
import com.github.droe.parser.Program.ArrayLiteral;
import com.github.droe.parser.Program.Assignment;
import com.github.droe.parser.Program.BinaryOp;
import com.github.droe.parser.Program.CollectionKind;
import com.github.droe.parser.Program.Container;
import com.github.droe.parser.Program.DataDefinition;
import com.github.droe.parser.Program.DataField;
import com.github.droe.parser.Program.DataInstance;
import com.github.droe.parser.Program.DisplayStatement;
import com.github.droe.parser.Program.ElementAccess;
import com.github.droe.parser.Program.Expression;
import com.github.droe.parser.Program.FieldAnnotation;
import com.github.droe.parser.Program.ForEachLoop;
import com.github.droe.parser.Program.FormatExpression;
import com.github.droe.parser.Program.Identifier;
import com.github.droe.parser.Program.IfStatement;
import com.github.droe.parser.Program.IncludeStatement;
import com.github.droe.parser.Program.Invocation;
import com.github.droe.parser.Program.InvocationStatement;
import com.github.droe.parser.Program.Literal;
import com.github.droe.parser.Program.ModuleDefinition;
import com.github.droe.parser.Program.Parameter;
import com.github.droe.parser.Program.PropertyAccess;
import com.github.droe.parser.Program.ReturnStatement;
import com.github.droe.parser.Program.Statement;
import com.github.droe.parser.Program.StringInterpolation;
import com.github.droe.parser.Program.TaskDefinition;
import com.github.droe.parser.Program.TypeAnnotation;
import com.github.droe.parser.Program.WhileLoop;
import com.github.droe.parser.Program.Widget;

import lombok.extern.slf4j.Slf4j;

/**
 * Validates a finished, include-resolved {@link Program}. Every declaration must carry a
 * type, every action must return a value of its declared type, conditions must be flags and
 * loops must iterate over collections. The first violation aborts the check with a
 * {@link TypeCheckException}; the program itself is never modified.
 */
@Slf4j
public class TypeChecker {

    private static final TypeInfo UNKNOWN = TypeInfo.of(ValueType.UNKNOWN);

    private final Map<String, ActionDefinition> actions = new HashMap<>();
    private final Map<String, TaskDefinition> tasks = new HashMap<>();
    private final Map<String, DataDefinition> dataTypes = new HashMap<>();

    private SymbolTable scope = new SymbolTable();
    private ActionContext currentAction;

    private static class ActionContext {
        final String name;
        final TypeInfo returnType;
        int returns;

        ActionContext(String name, TypeInfo returnType) {
            this.name = name;
            this.returnType = returnType;
        }
    }

    public void check(Program program) {
        actions.clear();
        tasks.clear();
        dataTypes.clear();
        scope = new SymbolTable();
        currentAction = null;

        collect(program.statements(), Optional.empty());
        checkStatements(program.statements());

        log.debug("Type checked {} statements, {} actions, {} tasks, {} data types",
                program.statements().size(), actions.size(), tasks.size(), dataTypes.size());
    }

    /**
     * Symbol table of the outermost scope after the last {@link #check}.
     */
    public SymbolTable globals() {
        return scope;
    }

    // signatures are collected first so that calls may precede definitions
    private void collect(List<Statement> statements, Optional<String> module) {
        for (var statement : statements) {
            if (statement instanceof ActionDefinition action) {
                module.ifPresent(m -> actions.put(m + "." + action.name(), action));
                actions.putIfAbsent(action.name(), action);
            } else if (statement instanceof TaskDefinition task) {
                module.ifPresent(m -> tasks.put(m + "." + task.name(), task));
                tasks.putIfAbsent(task.name(), task);
            } else if (statement instanceof DataDefinition data) {
                dataTypes.putIfAbsent(data.name(), data);
            } else if (statement instanceof ModuleDefinition definition) {
                collect(definition.body(), Optional.of(definition.name()));
            }
        }
    }

    private void checkStatements(List<Statement> statements) {
        for (var statement : statements) {
            checkStatement(statement);
        }
    }

    private void checkStatement(Statement statement) {
        int line = statement.line();
        if (statement instanceof DisplayStatement display) {
            infer(display.expression(), line);
        } else if (statement instanceof Assignment assignment) {
            checkAssignment(assignment);
        } else if (statement instanceof IfStatement ifStatement) {
            requireFlag(ifStatement.condition(), "If condition", line);
            checkStatements(ifStatement.thenBody());
            ifStatement.elseBody().ifPresent(this::checkStatements);
        } else if (statement instanceof WhileLoop loop) {
            requireFlag(loop.condition(), "While condition", line);
            checkStatements(loop.body());
        } else if (statement instanceof ForEachLoop loop) {
            checkForEach(loop);
        } else if (statement instanceof ReturnStatement ret) {
            checkReturn(ret);
        } else if (statement instanceof IncludeStatement) {
            // resolved before type checking
        } else if (statement instanceof InvocationStatement invocation) {
            checkInvocation(invocation.invocation(), line, false);
        } else if (statement instanceof TaskDefinition task) {
            checkTask(task);
        } else if (statement instanceof ActionDefinition action) {
            checkAction(action);
        } else if (statement instanceof ModuleDefinition module) {
            checkStatements(module.body());
        } else if (statement instanceof DataDefinition data) {
            checkDataDefinition(data);
        } else if (statement instanceof Container container) {
            checkStatements(container.children());
        } else if (statement instanceof Widget) {
            // widgets carry no expressions
        } else {
            throw new IllegalStateException("Unhandled statement " + statement);
        }
    }

    private void checkAssignment(Assignment assignment) {
        int line = assignment.line();
        var annotation = assignment.declaredType().orElseThrow(() -> new TypeCheckException(line,
                "Variable '" + assignment.variable() + "' must have explicit type declaration"));
        var declared = resolveType(annotation, line);
        var observed = infer(assignment.value(), line);

        if (!TypeInfo.isCompatible(declared, observed)) {
            throw new TypeCheckException(line, "Type mismatch: cannot assign " + observed.describe()
                    + " to " + annotation.describe() + " variable '" + assignment.variable() + "'");
        }
        if (declared.elementType().isEmpty() && declared.type().isCollection()) {
            declared = declared.withElementType(observed.elementType());
        }

        var existing = scope.lookup(assignment.variable());
        if (existing.isPresent()) {
            var previous = existing.get().type();
            if (!TypeInfo.isCompatible(previous, declared)) {
                throw new TypeCheckException(line, "Cannot redeclare '" + assignment.variable() + "' as "
                        + declared.describe() + ", it was declared as " + previous.describe());
            }
            if (TypeInfo.isWidening(previous, declared)) {
                throw new TypeCheckException(line, "Cannot widen '" + assignment.variable() + "' from "
                        + previous.describe() + " to " + declared.describe() + " on redeclaration");
            }
        }
        scope.declare(assignment.variable(), declared);
    }

    private void checkForEach(ForEachLoop loop) {
        int line = loop.line();
        var iterable = infer(loop.iterable(), line);
        if (!iterable.type().isCollection() && !iterable.isUnknown()) {
            throw new TypeCheckException(line, "For each requires a collection, got " + iterable.describe());
        }
        var element = iterable.elementType().orElse(UNKNOWN);

        var outer = scope;
        scope = scope.child();
        try {
            scope.declare(loop.variable(), element);
            checkStatements(loop.body());
        } finally {
            scope = outer;
        }
    }

    private void checkReturn(ReturnStatement ret) {
        int line = ret.line();
        if (currentAction == null) {
            throw new TypeCheckException(line, "'" + ret.style().keyword() + "' is only allowed inside an action");
        }
        var observed = infer(ret.expression(), line);
        if (!TypeInfo.isCompatible(currentAction.returnType, observed)) {
            throw new TypeCheckException(line, "Action '" + currentAction.name + "' return type mismatch: declared "
                    + currentAction.returnType.describe() + ", but returns " + observed.describe());
        }
        currentAction.returns++;
    }

    private void checkTask(TaskDefinition task) {
        withParameters(task.parameters(), task.line(), null, () -> checkStatements(task.body()));
    }

    private void checkAction(ActionDefinition action) {
        int line = action.line();
        var annotation = action.returnType().orElseThrow(() -> new TypeCheckException(line,
                "Action '" + action.name() + "' must declare a return type"));
        var context = new ActionContext(action.name(), resolveType(annotation, line));

        withParameters(action.parameters(), line, context, () -> checkStatements(action.body()));

        if (context.returns == 0) {
            throw new TypeCheckException(line, "Action '" + action.name()
                    + "' must have at least one 'give', 'respond with', 'answer is' or 'output' statement");
        }
    }

    private void withParameters(List<Parameter> parameters, int line, ActionContext context, Runnable body) {
        var outerScope = scope;
        var outerAction = currentAction;
        scope = scope.child();
        currentAction = context;
        try {
            for (var parameter : parameters) {
                if (scope.isDeclaredLocally(parameter.name())) {
                    throw new TypeCheckException(line, "Duplicate parameter '" + parameter.name() + "'");
                }
                scope.declare(parameter.name(), resolveType(parameter.type(), line));
            }
            body.run();
        } finally {
            scope = outerScope;
            currentAction = outerAction;
        }
    }

    private void checkDataDefinition(DataDefinition data) {
        var seen = new HashSet<String>();
        for (var field : data.fields()) {
            if (!seen.add(field.name())) {
                throw new TypeCheckException(data.line(),
                        "Duplicate field '" + field.name() + "' in data " + data.name());
            }
            resolveType(field.type(), data.line());
        }
    }

    private void requireFlag(Expression condition, String what, int line) {
        var type = infer(condition, line);
        if (!type.type().isBoolean() && !type.isUnknown()) {
            throw new TypeCheckException(line, what + " must be boolean, got " + type.describe());
        }
    }

    TypeInfo resolveType(TypeAnnotation annotation, int line) {
        var base = resolveBaseType(annotation.typeName(), line);
        if (annotation.collectionKind().isEmpty()) {
            return base;
        }
        var kind = annotation.collectionKind().get() == CollectionKind.LIST ? ValueType.LIST_OF : ValueType.GROUP_OF;
        return TypeInfo.collection(kind, base);
    }

    private TypeInfo resolveBaseType(String name, int line) {
        var builtin = ValueType.fromName(name);
        if (builtin.isPresent()) {
            return TypeInfo.of(builtin.get());
        }
        if (dataTypes.containsKey(name)) {
            return TypeInfo.data(name);
        }
        throw new TypeCheckException(line, "Unknown type '" + name + "'");
    }

    // expressions

    TypeInfo infer(Expression expression, int line) {
        if (expression instanceof Literal literal) {
            return switch (literal.type()) {
                case STRING -> TypeInfo.of(ValueType.TEXT);
                case BOOLEAN -> TypeInfo.of(ValueType.FLAG);
                case NUMBER -> TypeInfo.of(literal.isInteger() ? ValueType.INT : ValueType.DECIMAL);
            };
        } else if (expression instanceof Identifier identifier) {
            return inferIdentifier(identifier.name(), line);
        } else if (expression instanceof PropertyAccess access) {
            return inferProperty(access, line);
        } else if (expression instanceof ElementAccess access) {
            var target = infer(access.target(), line);
            if (!target.type().isCollection() && !target.isUnknown()) {
                throw new TypeCheckException(line, "Cannot index into " + target.describe());
            }
            var index = infer(access.index(), line);
            if (!index.type().isNumeric() && !index.isUnknown()) {
                throw new TypeCheckException(line, "Index must be numeric, got " + index.describe());
            }
            return target.elementType().orElse(UNKNOWN);
        } else if (expression instanceof BinaryOp op) {
            return inferBinary(op, line);
        } else if (expression instanceof ArithmeticOp op) {
            return inferArithmetic(op, line);
        } else if (expression instanceof ArrayLiteral array) {
            return inferArray(array, line);
        } else if (expression instanceof StringInterpolation interpolation) {
            interpolation.parts().forEach(part -> infer(part, line));
            return TypeInfo.of(ValueType.TEXT);
        } else if (expression instanceof FormatExpression format) {
            infer(format.expression(), line);
            return TypeInfo.of(ValueType.TEXT);
        } else if (expression instanceof Invocation invocation) {
            return checkInvocation(invocation, line, true).orElseThrow();
        } else if (expression instanceof DataInstance instance) {
            return inferDataInstance(instance, line);
        }
        throw new IllegalStateException("Unhandled expression " + expression);
    }

    private TypeInfo inferIdentifier(String name, int line) {
        var variable = scope.lookup(name);
        if (variable.isPresent()) {
            return variable.get().type();
        }
        if (actions.containsKey(name) || tasks.containsKey(name)) {
            return checkInvocation(new Invocation(name, List.of()), line, true).orElseThrow();
        }
        throw new TypeCheckException(line, "Undefined variable or action: " + name);
    }

    private TypeInfo inferProperty(PropertyAccess access, int line) {
        var target = infer(access.target(), line);
        if (target.isUnknown()) {
            return UNKNOWN;
        }
        if (target.type() != ValueType.DATA) {
            throw new TypeCheckException(line, "Cannot read property '" + access.property() + "' of " + target.describe());
        }
        var data = dataTypes.get(target.dataName().orElseThrow());
        return data.fields().stream()
                .filter(f -> f.name().equals(access.property()))
                .findFirst()
                .map(f -> resolveType(f.type(), line))
                .orElseThrow(() -> new TypeCheckException(line,
                        "Data " + data.name() + " has no field '" + access.property() + "'"));
    }

    private TypeInfo inferBinary(BinaryOp op, int line) {
        var left = infer(op.left(), line);
        var right = infer(op.right(), line);
        if (op.operator().equals("&&") || op.operator().equals("||")) {
            if (!isBooleanOrUnknown(left) || !isBooleanOrUnknown(right)) {
                throw new TypeCheckException(line, "Logical operator '" + op.operator()
                        + "' requires boolean operands, got " + left.describe() + " and " + right.describe());
            }
        }
        return TypeInfo.of(ValueType.FLAG);
    }

    private static boolean isBooleanOrUnknown(TypeInfo type) {
        return type.type().isBoolean() || type.isUnknown();
    }

    private TypeInfo inferArithmetic(ArithmeticOp op, int line) {
        var left = infer(op.left(), line).type();
        var right = infer(op.right(), line).type();
        if (left == ValueType.UNKNOWN || right == ValueType.UNKNOWN) {
            var known = left == ValueType.UNKNOWN ? right : left;
            if (known == ValueType.UNKNOWN || known.isNumeric() || op.operator().equals("+") && known.isTextual()) {
                return TypeInfo.of(known);
            }
        } else if (left.isNumeric() && right.isNumeric()) {
            return TypeInfo.of(left == ValueType.DECIMAL || right == ValueType.DECIMAL ? ValueType.DECIMAL : ValueType.INT);
        }
        if (op.operator().equals("+") && (left.isTextual() || right.isTextual())) {
            return TypeInfo.of(ValueType.TEXT);
        }
        throw new TypeCheckException(line, "Invalid arithmetic operation " + op.operator() + " between "
                + left.typeName() + " and " + right.typeName());
    }

    private TypeInfo inferArray(ArrayLiteral array, int line) {
        TypeInfo element = null;
        for (var item : array.elements()) {
            var type = infer(item, line);
            if (element == null) {
                element = type;
            } else if (!TypeInfo.isCompatible(element, type)) {
                throw new TypeCheckException(line, "List elements must share one type, got "
                        + element.describe() + " and " + type.describe());
            }
        }
        return new TypeInfo(ValueType.LIST_OF, Optional.empty(), Optional.ofNullable(element));
    }

    private TypeInfo inferDataInstance(DataInstance instance, int line) {
        var data = dataTypes.get(instance.typeName());
        if (data == null) {
            throw new TypeCheckException(line, "Unknown data type '" + instance.typeName() + "'");
        }
        var assigned = new HashSet<String>();
        for (var field : instance.fields()) {
            var definition = data.fields().stream()
                    .filter(f -> f.name().equals(field.field()))
                    .findFirst()
                    .orElseThrow(() -> new TypeCheckException(line,
                            "Data " + data.name() + " has no field '" + field.field() + "'"));
            var declared = resolveType(definition.type(), line);
            var observed = infer(field.value(), line);
            if (!TypeInfo.isCompatible(declared, observed)) {
                throw new TypeCheckException(line, "Field '" + field.field() + "' of " + data.name() + " expects "
                        + declared.describe() + " but got " + observed.describe());
            }
            assigned.add(field.field());
        }
        for (DataField field : data.fields()) {
            if (field.annotations().contains(FieldAnnotation.REQUIRED) && !assigned.contains(field.name())) {
                throw new TypeCheckException(line, "Missing required field '" + field.name() + "' for " + data.name());
            }
        }
        return TypeInfo.data(data.name());
    }

    /**
     * Checks the target and arguments of a call. Returns the action's return type, or empty
     * for a task called as a statement.
     */
    private Optional<TypeInfo> checkInvocation(Invocation invocation, int line, boolean needsValue) {
        var name = invocation.qualifiedName();
        var action = actions.get(name);
        if (action != null) {
            checkArguments(name, action.parameters(), invocation.arguments(), line);
            var returnType = action.returnType().orElseThrow(() -> new TypeCheckException(line,
                    "Action '" + name + "' must declare a return type"));
            return Optional.of(resolveType(returnType, line));
        }
        var task = tasks.get(name);
        if (task != null) {
            if (needsValue) {
                throw new TypeCheckException(line, "Task '" + name + "' does not produce a value");
            }
            checkArguments(name, task.parameters(), invocation.arguments(), line);
            return Optional.empty();
        }
        throw new TypeCheckException(line, "Unknown action: " + name);
    }

    private void checkArguments(String name, List<Parameter> parameters, List<Expression> arguments, int line) {
        if (parameters.size() != arguments.size()) {
            throw new TypeCheckException(line, "'" + name + "' expects " + parameters.size()
                    + " argument(s) but got " + arguments.size());
        }
        for (int i = 0; i < parameters.size(); i++) {
            var parameter = parameters.get(i);
            var declared = resolveType(parameter.type(), line);
            var observed = infer(arguments.get(i), line);
            if (!TypeInfo.isCompatible(declared, observed)) {
                throw new TypeCheckException(line, "Argument '" + parameter.name() + "' of '" + name
                        + "' expects " + declared.describe() + " but got " + observed.describe());
            }
        }
    }
}
