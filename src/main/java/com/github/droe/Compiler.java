package com.github.droe;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.github.droe.modules.ModuleResolver;
import com.github.droe.parser.Parser;
import com.github.droe.parser.ParserConfig;
import com.github.droe.parser.Program;
import com.github.droe.typer.TypeChecker;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the front end over a source file: parse, resolve includes, type check. The result is
 * the validated {@link Program} a code generator consumes.
 */
@Slf4j
public class Compiler implements ConfigReader.ConfigTarget {

    @Setter
    private List<String> lookupPath = new ArrayList<>();
    @Setter
    private ParserConfig parserConfig = ParserConfig.defaults();

    public static void main(String[] args) {
        var compiler = new Compiler();
        ConfigReader.readConfig().applyConfig(compiler);

        int failures = 0;
        for (var arg : args) {
            try {
                var program = compiler.compileFile(Path.of(arg));
                log.info("{}: ok, {} statements, target {}", arg, program.statements().size(),
                        program.metadata("target").map(m -> m.value()).orElse("default"));
            } catch (DroeException e) {
                log.error("{}: {}", arg, e.getMessage());
                failures++;
            } catch (IOException e) {
                log.error("{}: cannot read file: {}", arg, e.getMessage());
                failures++;
            }
        }
        if (failures > 0) {
            System.exit(1);
        }
    }

    public Program compileFile(Path file) throws IOException {
        log.debug("Compiling {}", file);
        return compile(Files.readString(file, StandardCharsets.UTF_8), file);
    }

    /**
     * @param file location the source was read from; includes are resolved relative to it
     */
    public Program compile(String source, Path file) {
        var parser = new Parser(parserConfig);
        var program = parser.parse(source);
        var resolved = newResolver(parser).resolveIncludes(program, file);
        new TypeChecker().check(resolved);
        return resolved;
    }

    ModuleResolver newResolver(Parser parser) {
        return new ModuleResolver(parser, lookupPath.stream().map(Path::of).toList());
    }
}
