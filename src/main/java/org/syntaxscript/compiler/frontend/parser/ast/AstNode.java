package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public sealed interface AstNode permits ProgramStatement, Statement, Expression {

    /**
     * @return The kind of this node.
     */
    NodeType type();

    /**
     * @return The 1-based source range covered by this node.
     */
    SourceRange range();
}
