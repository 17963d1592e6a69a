package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

import java.util.List;

/**
 * The root of every parsed file.
 *
 * @param body  The top-level statements in source order.
 * @param range The range from the origin to the end of the file.
 */
public record ProgramStatement(List<Statement> body, SourceRange range) implements AstNode {

    public ProgramStatement {
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.PROGRAM;
    }
}
