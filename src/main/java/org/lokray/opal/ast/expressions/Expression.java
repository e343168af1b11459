package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTNode;

/**
 * Base interface for all expression nodes.
 */
public interface Expression extends ASTNode
{
}
