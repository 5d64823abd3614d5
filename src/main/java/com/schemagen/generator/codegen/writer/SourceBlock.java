package com.schemagen.generator.codegen.writer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable, ordered list of source lines with declared indentation levels.
 *
 * Indentation is resolved only when the block is rendered, so blocks can be
 * nested into other blocks at any depth without rewriting their text. A block
 * never starts or ends with a blank line.
 */
public final class SourceBlock {

    private static final SourceBlock EMPTY = new SourceBlock(List.of());

    private final List<SourceLine> lines;

    private SourceBlock(List<SourceLine> lines) {
        this.lines = List.copyOf(lines);
    }

    public static SourceBlock empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a block from raw text, one line per {@code \n}, all at level 0.
     */
    public static SourceBlock ofText(String text) {
        Builder builder = builder();
        for (String line : text.split("\n", -1)) {
            builder.line(line.stripTrailing());
        }
        return builder.build();
    }

    public List<SourceLine> getLines() {
        return lines;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * Returns a copy of this block shifted right by {@code levels}.
     */
    public SourceBlock indented(int levels) {
        return new SourceBlock(lines.stream()
                .map(l -> new SourceLine(l.getIndentLevel() + levels, l.getText()))
                .collect(Collectors.toList()));
    }

    /**
     * Renders the block with {@code indent} per level, lines joined by {@code \n},
     * without a trailing newline.
     */
    public String render(String indent) {
        return lines.stream().map(l -> l.render(indent)).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return render("    ");
    }

    /**
     * Accumulates lines while tracking the current indentation level.
     */
    public static final class Builder {
        private final List<SourceLine> lines = new ArrayList<>();
        private int level;

        private Builder() {
        }

        public Builder line(String text) {
            lines.add(new SourceLine(text.isBlank() ? 0 : level, text.isBlank() ? "" : text));
            return this;
        }

        public Builder blankLine() {
            return line("");
        }

        /**
         * Writes {@code header} and indents following lines one level.
         */
        public Builder open(String header) {
            line(header);
            level++;
            return this;
        }

        public Builder close() {
            if (level == 0) {
                throw new IllegalStateException("close() without matching open()");
            }
            level--;
            return this;
        }

        /**
         * Appends every line of {@code block} relative to the current level.
         */
        public Builder append(SourceBlock block) {
            for (SourceLine l : block.getLines()) {
                lines.add(l.isBlank() ? l : new SourceLine(l.getIndentLevel() + level, l.getText()));
            }
            return this;
        }

        public SourceBlock build() {
            int start = 0;
            int end = lines.size();
            while (start < end && lines.get(start).isBlank()) {
                start++;
            }
            while (end > start && lines.get(end - 1).isBlank()) {
                end--;
            }
            return new SourceBlock(lines.subList(start, end));
        }
    }
}
