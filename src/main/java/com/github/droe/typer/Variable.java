package com.github.droe.typer;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@ToString
@AllArgsConstructor
@Accessors(fluent = true)
public class Variable {
    private final String name;
    @Setter
    private TypeInfo type;
    /** Slot number in declaration order, stable across redeclaration. */
    private final int index;
}
