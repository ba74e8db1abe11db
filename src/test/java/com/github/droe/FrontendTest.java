package com.github.droe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

import com.github.droe.modules.ModuleResolutionException;
import com.github.droe.parser.ParseException;
import com.github.droe.typer.TypeCheckException;

/**
 * Compiles every {@code .roe} file under {@code frontend-tests}. The first line names the
 * expected outcome, e.g. {@code // EXPECT: type-error}; successful programs may also state
 * their statement count after resolution with {@code // STATEMENTS: n}.
 */
public class FrontendTest {

    private static final String EXPECT = "// EXPECT:";
    private static final String STATEMENTS = "// STATEMENTS:";

    @TestFactory
    public DynamicNode testFactory() {
        String basePathString = "src/test/resources/frontend-tests";
        Path basePath = Paths.get(basePathString);

        var testFiles = basePath.toFile().listFiles((dir, name) -> name.endsWith(".roe"));
        var tests = Arrays.stream(testFiles)
            .sorted(Comparator.comparing(File::getName))
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Frontend tests", tests);
    }

    private DynamicNode createTest(File testFile) {
        var testName = testFile.getName().substring(0, testFile.getName().indexOf('.'));
        return DynamicTest.dynamicTest("compile " + testName, () -> {
            var lines = Files.readAllLines(testFile.toPath());
            var expected = header(lines.get(0), EXPECT, testFile);
            var compiler = new Compiler();

            switch (expected) {
                case "ok" -> {
                    var program = compiler.compileFile(testFile.toPath());
                    lines.stream()
                        .filter(l -> l.startsWith(STATEMENTS))
                        .findFirst()
                        .ifPresent(l -> assertEquals(Integer.parseInt(header(l, STATEMENTS, testFile)),
                                program.statements().size()));
                }
                case "parse-error" -> assertThrows(ParseException.class, () -> compiler.compileFile(testFile.toPath()));
                case "type-error" -> assertThrows(TypeCheckException.class, () -> compiler.compileFile(testFile.toPath()));
                case "module-error" -> assertThrows(ModuleResolutionException.class,
                        () -> compiler.compileFile(testFile.toPath()));
                default -> fail("Unknown expectation '" + expected + "' in " + testFile);
            }
        });
    }

    private static String header(String line, String prefix, File testFile) {
        if (!line.startsWith(prefix)) {
            fail(testFile + " must start with '" + prefix + " <outcome>'");
        }
        return line.substring(prefix.length()).trim();
    }
}
