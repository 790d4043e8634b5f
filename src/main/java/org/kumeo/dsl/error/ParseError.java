package org.kumeo.dsl.error;

import org.kumeo.dsl.tree.SourceLocation;
import org.kumeo.dsl.tree.SourceSpan;

import java.util.List;

/**
 * Syntax error with location and context information.
 */
public sealed interface ParseError extends CompileError {
    String code();

    @Override
    default List<Diagnostic> diagnostics() {
        return List.of(Diagnostic.error(code(), message(), SourceSpan.at(location())));
    }

    /**
     * A token that does not fit the grammar at this point.
     */
    record UnexpectedInput(SourceLocation location, String found, String expected) implements ParseError {
        @Override
        public String code() {
            return "E0101";
        }

        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * Input ended while a construct was still open.
     */
    record UnexpectedEof(SourceLocation location, String expected) implements ParseError {
        @Override
        public String code() {
            return "E0102";
        }

        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Well-formed tokens that do not make a valid construct, e.g. a source tag with no channel.
     */
    record InvalidConstruct(SourceLocation location, String reason) implements ParseError {
        @Override
        public String code() {
            return "E0103";
        }

        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * A section or object key given twice in the same block.
     */
    record Duplicate(SourceLocation location, String what) implements ParseError {
        @Override
        public String code() {
            return "E0104";
        }

        @Override
        public String message() {
            return "Duplicate " + what + " at " + location;
        }
    }
}
