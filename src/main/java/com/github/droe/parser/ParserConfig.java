package com.github.droe.parser;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Settings that choose between the grammar variants the parser accepts.
 */
@Getter
@Builder
@ToString
@Accessors(fluent = true)
public class ParserConfig {

    public enum BlockStyle {
        /** Blocks close on an {@code end <keyword>} line. */
        SENTINEL,
        /** Blocks close when indentation falls back to the opening line's level. */
        INDENTATION
    }

    @Builder.Default
    private final BlockStyle blockStyle = BlockStyle.SENTINEL;
    @Builder.Default
    private final boolean hashComments = true;

    public static ParserConfig defaults() {
        return ParserConfig.builder().build();
    }
}
