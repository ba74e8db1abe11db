package com.github.droe.modules;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.github.droe.parser.ParseException;
import com.github.droe.parser.Parser;
import com.github.droe.parser.Program;
import com.github.droe.parser.Program.ActionDefinition;
import com.github.droe.parser.Program.IncludeStatement;
import com.github.droe.parser.Program.ModuleDefinition;
import com.github.droe.parser.Program.Statement;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads the files named by {@code include} statements and flattens them into the including
 * program. Included statements come first, in include order, and a module reached along
 * several include paths is merged only once. Parsed modules are cached by name until
 * {@link #clearCache()}.
 */
@Slf4j
public class ModuleResolver {

    private final Parser parser;
    private final List<Path> lookupPath;

    private final Map<String, LoadedModule> loadedModules = new LinkedHashMap<>();
    // files whose includes are being resolved, mapped to their module names
    private final Map<Path, String> loadingStack = new LinkedHashMap<>();

    private record LoadedModule(String name, Path path, Program program) {}

    public ModuleResolver(Parser parser) {
        this(parser, List.of());
    }

    public ModuleResolver(Parser parser, List<Path> lookupPath) {
        this.parser = parser;
        this.lookupPath = List.copyOf(lookupPath);
    }

    public Program resolveIncludes(Program program, Path currentFile) {
        var file = currentFile.toAbsolutePath().normalize();
        List<String> order = new ArrayList<>();
        List<IncludeStatement> includes = new ArrayList<>();

        loadingStack.clear();
        loadingStack.put(file, moduleName(file));
        try {
            collect(program, file.getParent(), order, includes, new HashSet<>());
        } finally {
            loadingStack.clear();
        }

        if (includes.isEmpty()) {
            return program;
        }

        List<Statement> statements = new ArrayList<>();
        for (var name : order) {
            statements.addAll(ownStatements(loadedModules.get(name).program()));
        }
        statements.addAll(ownStatements(program));
        log.debug("Resolved {} include(s) for {}: {}", includes.size(), file, order);
        return new Program(statements, program.metadata(), includes);
    }

    private void collect(Program program, Path directory, List<String> order,
            List<IncludeStatement> includes, Set<String> visited) {
        for (var statement : program.statements()) {
            if (!(statement instanceof IncludeStatement include)) {
                continue;
            }
            var name = include.moduleName();
            var cached = loadedModules.get(name);
            var path = cached != null ? cached.path() : locate(include, directory);

            if (loadingStack.containsKey(path)) {
                throw new ModuleResolutionException(include.line(), "Circular include detected: " + cycle(path, name));
            }
            if (!visited.add(name)) {
                continue;
            }
            includes.add(include);

            var module = cached != null ? cached : load(name, path);
            loadingStack.put(path, name);
            try {
                collect(module.program(), path.getParent(), order, includes, visited);
            } finally {
                loadingStack.remove(path);
            }
            order.add(name);
        }
    }

    private String cycle(Path path, String name) {
        List<String> chain = new ArrayList<>();
        boolean inCycle = false;
        for (var entry : loadingStack.entrySet()) {
            inCycle |= entry.getKey().equals(path);
            if (inCycle) {
                chain.add(entry.getValue());
            }
        }
        chain.add(name);
        return String.join(" -> ", chain);
    }

    private LoadedModule load(String name, Path path) {
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ModuleResolutionException("Failed to read module " + name + ": " + e.getMessage(), e);
        }

        Program program;
        try {
            program = parser.parse(source);
        } catch (ParseException e) {
            throw new ModuleResolutionException("Failed to parse module " + name + " (" + path + "): "
                    + e.getMessage(), e);
        }

        var module = new LoadedModule(name, path, program);
        loadedModules.put(name, module);
        log.debug("Loaded module {} from {}", name, path);
        return module;
    }

    /** The including file's directory first, then the lookup path. */
    private Path locate(IncludeStatement include, Path directory) {
        List<Path> candidates = new ArrayList<>();
        candidates.add(directory.resolve(include.filePath()));
        for (var entry : lookupPath) {
            candidates.add(entry.resolve(include.filePath()));
        }
        return candidates.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .filter(Files::isRegularFile)
                .findFirst()
                .orElseThrow(() -> new ModuleResolutionException(include.line(),
                        "Module file not found: " + include.filePath() + " (searched "
                                + candidates.stream().map(Path::toString).collect(Collectors.joining(", ")) + ")"));
    }

    private static List<Statement> ownStatements(Program program) {
        return program.statements().stream()
                .filter(s -> !(s instanceof IncludeStatement))
                .toList();
    }

    private static String moduleName(Path file) {
        var fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Actions a loaded module defines, at top level or inside its {@code module} blocks.
     */
    public List<ActionDefinition> moduleActions(String moduleName) {
        var module = loadedModules.get(moduleName);
        if (module == null) {
            throw new ModuleResolutionException("Module not loaded: " + moduleName);
        }
        List<ActionDefinition> actions = new ArrayList<>();
        for (var statement : module.program().statements()) {
            if (statement instanceof ActionDefinition action) {
                actions.add(action);
            } else if (statement instanceof ModuleDefinition definition) {
                definition.body().stream()
                        .filter(ActionDefinition.class::isInstance)
                        .map(ActionDefinition.class::cast)
                        .forEach(actions::add);
            }
        }
        return actions;
    }

    public Optional<ActionDefinition> findAction(String moduleName, String actionName) {
        if (!loadedModules.containsKey(moduleName)) {
            return Optional.empty();
        }
        return moduleActions(moduleName).stream()
                .filter(a -> a.name().equals(actionName))
                .findFirst();
    }

    /** Parsed programs of every cached module, by module name. */
    public Map<String, Program> loadedModules() {
        Map<String, Program> result = new LinkedHashMap<>();
        loadedModules.forEach((name, module) -> result.put(name, module.program()));
        return Collections.unmodifiableMap(result);
    }

    public void clearCache() {
        loadedModules.clear();
        loadingStack.clear();
    }
}
