package com.github.droe.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

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

public class ExpressionParserTest {

    @ParameterizedTest
    @MethodSource("expressions")
    public void testExpressionParse(String code, Expression expected) {
        assertEquals(expected, new ExpressionParser().parse(code));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "x = 5", "a b", "5 +", "\"unterminated [x\"", "Format(x)", "items[0" })
    public void testInvalidExpression(String code) {
        assertThrows(ParseException.class, () -> new ExpressionParser().parse(code));
    }

    @Test
    public void testNaturalAndSymbolicComparisonsAreEqual() {
        var parser = new ExpressionParser();
        assertEquals(parser.parse("age > 18"), parser.parse("age is greater than 18"));
        assertEquals(parser.parse("a <= b"), parser.parse("a is less than or equal to b"));
        assertEquals(parser.parse("a != b"), parser.parse("a does not equal b"));
        assertEquals(parser.parse("a == b"), parser.parse("a is equal to b"));
    }

    @Test
    public void testArguments() {
        assertEquals(
                List.of(Literal.of("a, b"), new Invocation("f", List.of(new Identifier("x"), new Identifier("y")))),
                new ExpressionParser().parseArguments("\"a, b\", f(x, y)"));
    }

    private static Object[][] expressions() {
        return new Object[][] {
            {
                "age > 18",
                new BinaryOp(new Identifier("age"), ">", Literal.of(18))
            }, {
                "age is greater than 18",
                new BinaryOp(new Identifier("age"), ">", Literal.of(18))
            }, {
                "a is greater than or equal to b",
                new BinaryOp(new Identifier("a"), ">=", new Identifier("b"))
            }, {
                "x is not 5",
                new BinaryOp(new Identifier("x"), "!=", Literal.of(5))
            }, {
                "x is not equal to 5",
                new BinaryOp(new Identifier("x"), "!=", Literal.of(5))
            }, {
                "x equals \"yes\"",
                new BinaryOp(new Identifier("x"), "==", Literal.of("yes"))
            }, {
                "x is true",
                new BinaryOp(new Identifier("x"), "==", Literal.of(true))
            }, {
                "\"is greater than\"",
                Literal.of("is greater than")
            }, {
                "'single // quoted'",
                Literal.of("single // quoted")
            }, {
                "true",
                Literal.of(true)
            }, {
                "the condition is false",
                Literal.of(false)
            }, {
                "-5",
                Literal.of(-5)
            }, {
                "3.14",
                Literal.of(3.14)
            }, {
                "a plus b times c",
                new ArithmeticOp(new Identifier("a"), "+",
                        new ArithmeticOp(new Identifier("b"), "*", new Identifier("c")))
            }, {
                "a + b * c",
                new ArithmeticOp(new Identifier("a"), "+",
                        new ArithmeticOp(new Identifier("b"), "*", new Identifier("c")))
            }, {
                "a - b - c",
                new ArithmeticOp(
                        new ArithmeticOp(new Identifier("a"), "-", new Identifier("b")),
                        "-", new Identifier("c"))
            }, {
                "(a + b) * c",
                new ArithmeticOp(
                        new ArithmeticOp(new Identifier("a"), "+", new Identifier("b")),
                        "*", new Identifier("c"))
            }, {
                "total divided by 2",
                new ArithmeticOp(new Identifier("total"), "/", Literal.of(2))
            }, {
                "n % 2",
                new ArithmeticOp(new Identifier("n"), "%", Literal.of(2))
            }, {
                "3 - -2",
                new ArithmeticOp(Literal.of(3), "-", Literal.of(-2))
            }, {
                "\"Hello, \" + name",
                new ArithmeticOp(Literal.of("Hello, "), "+", new Identifier("name"))
            }, {
                "a > 1 and b < 2",
                new BinaryOp(
                        new BinaryOp(new Identifier("a"), ">", Literal.of(1)),
                        "&&",
                        new BinaryOp(new Identifier("b"), "<", Literal.of(2)))
            }, {
                "done or a || b",
                new BinaryOp(
                        new BinaryOp(new Identifier("done"), "||", new Identifier("a")),
                        "||", new Identifier("b"))
            }, {
                "x + 1 is less than limit",
                new BinaryOp(
                        new ArithmeticOp(new Identifier("x"), "+", Literal.of(1)),
                        "<", new Identifier("limit"))
            }, {
                "[1, 2, 3]",
                new ArrayLiteral(List.of(Literal.of(1), Literal.of(2), Literal.of(3)))
            }, {
                "[]",
                new ArrayLiteral(List.of())
            }, {
                "[\"a, b\", [1, 2]]",
                new ArrayLiteral(List.of(Literal.of("a, b"),
                        new ArrayLiteral(List.of(Literal.of(1), Literal.of(2)))))
            }, {
                "\"Hello [name]!\"",
                new StringInterpolation(List.of(Literal.of("Hello "), new Identifier("name"), Literal.of("!")))
            }, {
                "\"Hi ${user.name}\"",
                new StringInterpolation(List.of(Literal.of("Hi "),
                        new PropertyAccess(new Identifier("user"), "name")))
            }, {
                "format price as \"0.00\"",
                new FormatExpression(new Identifier("price"), "0.00")
            }, {
                "Format(total, \"%.2f\")",
                new FormatExpression(new Identifier("total"), "%.2f")
            }, {
                "run greet with name, 5",
                new Invocation("greet", List.of(new Identifier("name"), Literal.of(5)))
            }, {
                "run refresh",
                new Invocation("refresh", List.of())
            }, {
                "Math.add with 1, 2",
                new Invocation("Math", "add", List.of(Literal.of(1), Literal.of(2)))
            }, {
                "greet(userName)",
                new Invocation("greet", List.of(new Identifier("userName")))
            }, {
                "Math.max(a, b + 1)",
                new Invocation("Math", "max", List.of(new Identifier("a"),
                        new ArithmeticOp(new Identifier("b"), "+", Literal.of(1))))
            }, {
                "Math.pi",
                new Invocation("Math", "pi", List.of())
            }, {
                "user.name",
                new PropertyAccess(new Identifier("user"), "name")
            }, {
                "items[0].name",
                new PropertyAccess(new ElementAccess(new Identifier("items"), Literal.of(0)), "name")
            }, {
                "items[i + 1]",
                new ElementAccess(new Identifier("items"),
                        new ArithmeticOp(new Identifier("i"), "+", Literal.of(1)))
            }, {
                "((count))",
                new Identifier("count")
            }
        };
    }
}
