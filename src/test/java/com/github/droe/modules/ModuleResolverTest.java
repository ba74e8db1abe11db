package com.github.droe.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.droe.parser.ParseException;
import com.github.droe.parser.Parser;
import com.github.droe.parser.Program;
import com.github.droe.parser.Program.Assignment;
import com.github.droe.parser.Program.DisplayStatement;
import com.github.droe.parser.Program.IncludeStatement;
import com.github.droe.parser.Program.Literal;
import com.github.droe.parser.Program.ModuleDefinition;

public class ModuleResolverTest {

    private static final String MATH = """
            module Math
                action square with n which is int gives int
                    give n * n
                end action
                action cube with n which is int gives int
                    give n * n * n
                end action
            end module
            """;

    @TempDir
    Path dir;

    private Parser parser;
    private ModuleResolver resolver;

    @BeforeEach
    public void setUp() {
        parser = new Parser();
        resolver = new ModuleResolver(parser);
    }

    private Path write(String name, String source) throws IOException {
        var file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, source);
        return file;
    }

    private Program resolve(Path file) throws IOException {
        return resolver.resolveIncludes(parser.parse(Files.readString(file)), file);
    }

    @Test
    public void testIncludeIsMerged() throws IOException {
        write("math.roe", MATH);
        var main = write("main.roe", """
                include Math from "math.roe"
                set r which is int from Math.square with 4
                display r
                """);

        var program = resolve(main);
        assertEquals(3, program.statements().size());
        assertInstanceOf(ModuleDefinition.class, program.statements().get(0));
        assertInstanceOf(Assignment.class, program.statements().get(1));
        assertEquals(List.of(new IncludeStatement("Math", "math.roe", 1)), program.includes());

        assertEquals(2, resolver.moduleActions("Math").size());
        assertEquals("square", resolver.findAction("Math", "square").orElseThrow().name());
        assertTrue(resolver.findAction("Math", "sqrt").isEmpty());
        assertTrue(resolver.findAction("Other", "square").isEmpty());
        assertEquals(List.of("Math"), List.copyOf(resolver.loadedModules().keySet()));
    }

    @Test
    public void testProgramWithoutIncludesIsUnchanged() throws IOException {
        var main = write("main.roe", "display 1");
        var program = parser.parse("display 1");
        assertSame(program, resolver.resolveIncludes(program, main));
    }

    @Test
    public void testCircularInclude() throws IOException {
        var a = write("A.roe", "include B from \"B.roe\"\ndisplay 1");
        write("B.roe", "include A from \"A.roe\"\ndisplay 2");

        var e = assertThrows(ModuleResolutionException.class, () -> resolve(a));
        assertTrue(e.getMessage().contains("Circular include detected: A -> B -> A"), e.getMessage());
    }

    @Test
    public void testSelfInclude() throws IOException {
        var a = write("self.roe", "include \"self.roe\"");
        var e = assertThrows(ModuleResolutionException.class, () -> resolve(a));
        assertTrue(e.getMessage().contains("Circular include detected: self -> self"), e.getMessage());
    }

    @Test
    public void testDiamondIsMergedOnce() throws IOException {
        write("d.roe", "display \"d\"");
        write("b.roe", "include D from \"d.roe\"\ndisplay \"b\"");
        write("c.roe", "include D from \"d.roe\"\ndisplay \"c\"");
        var main = write("main.roe", "include B from \"b.roe\"\ninclude C from \"c.roe\"\ndisplay \"main\"");

        var program = resolve(main);
        assertEquals(List.of(
                new DisplayStatement(Literal.of("d"), 1),
                new DisplayStatement(Literal.of("b"), 2),
                new DisplayStatement(Literal.of("c"), 2),
                new DisplayStatement(Literal.of("main"), 3)),
                program.statements());
        assertEquals(List.of("B", "D", "C"), program.includes().stream().map(IncludeStatement::moduleName).toList());
    }

    @Test
    public void testIncludeRelativeToIncludingFile() throws IOException {
        write("lib/helpers.roe", "display \"helper\"");
        write("lib/utils.roe", "include \"helpers.roe\"\ndisplay \"utils\"");
        var main = write("main.roe", "include \"lib/utils.roe\"");

        var program = resolve(main);
        assertEquals(2, program.statements().size());
        assertEquals(List.of("utils", "helpers"),
                program.includes().stream().map(IncludeStatement::moduleName).toList());
    }

    @Test
    public void testLookupPath() throws IOException {
        write("vendor/math.roe", MATH);
        var main = write("app/main.roe", "include Math from \"math.roe\"");

        var withoutPath = assertThrows(ModuleResolutionException.class, () -> resolve(main));
        assertTrue(withoutPath.getMessage().contains("Module file not found: math.roe"), withoutPath.getMessage());
        assertEquals(1, withoutPath.getLineNumber());

        resolver = new ModuleResolver(parser, List.of(dir.resolve("vendor")));
        assertEquals(1, resolve(main).statements().size());
    }

    @Test
    public void testParseErrorInModule() throws IOException {
        write("broken.roe", "set x to 1");
        var main = write("main.roe", "include \"broken.roe\"");

        var e = assertThrows(ModuleResolutionException.class, () -> resolve(main));
        assertTrue(e.getMessage().contains("Failed to parse module broken"), e.getMessage());
        assertInstanceOf(ParseException.class, e.getCause());
    }

    @Test
    public void testModulesAreCachedUntilCleared() throws IOException {
        var lib = write("lib.roe", "display 1");
        var main = write("main.roe", "include \"lib.roe\"");
        assertEquals(1, resolve(main).statements().size());

        Files.writeString(lib, "display 1\ndisplay 2");
        assertEquals(1, resolve(main).statements().size());

        resolver.clearCache();
        assertEquals(2, resolve(main).statements().size());
    }

    @Test
    public void testUnknownModule() {
        assertThrows(ModuleResolutionException.class, () -> resolver.moduleActions("Nope"));
    }
}
