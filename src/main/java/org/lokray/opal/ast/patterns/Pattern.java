package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTNode;

/**
 * Base interface for the patterns of match arms.
 */
public interface Pattern extends ASTNode
{
}
