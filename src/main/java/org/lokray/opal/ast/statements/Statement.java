package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTNode;

/**
 * Base interface for all statement nodes in function, method and accessor bodies.
 */
public interface Statement extends ASTNode
{
}
