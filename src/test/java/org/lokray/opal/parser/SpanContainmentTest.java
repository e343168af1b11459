package org.lokray.opal.parser;

import org.junit.jupiter.api.Test;
import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.statements.ForStatement;
import org.lokray.opal.lexer.Span;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpanContainmentTest
{
	private static final String SHOP = String.join("\n",
			"§M[m1:Shop]",
			"§U[System]",
			"§D[d1:Point] §FL[x:i32] §FL[y:i32] = 0 §/D[d1]",
			"§T[t1:Shape] §V[Circle] §FL[radius:f64] §V[Empty] §/T[t1]",
			"§EN[e1:Color] Red Green = 2 §/EN[e1]",
			"§DEL[dl1:Handler] §I[str:message] §O[bool] §/DEL[dl1]",
			"§CL[c1:Cart<T>] §FLD[i32:count] = 0",
			"  §PROP[p1:Size:i32] §GET §R count §/GET §/PROP[p1]",
			"  §CTOR[k1:pub] §I[i32:start] §BASE §A \"cart\" §/BASE §ASSIGN count start §/CTOR[k1]",
			"  §MT[mt1:Clear] §ASSIGN count 0 §/MT[mt1]",
			"  §EVT[ev1:Changed:pub:Handler]",
			"§/CL[c1]",
			"§F[f1:Main] §I[i32:n] §O[i32] §Q (> n 0) §EX (+ 1 2) → 3 §US[Helper, Audit?] §SN[1.0]",
			"  §L[l1:i:0:(- n 1)] §P i §/L[l1]",
			"  §L[l2:j:(* n 2):0:-1] §P j §/L[l2]",
			"  §B[buffer] §ARR[a1:i32:(+ n 1)]",
			"  §LIST[xs:i32] 1 2 §/LIST[xs]",
			"  §DICT[ages:str:i32] §KV \"a\" 1 §/DICT[ages]",
			"  §PUSH[xs] 3",
			"  §PUT[ages] \"b\" 2",
			"  §B[found] §HAS[xs] 3",
			"  §B[size] §CNT[xs]",
			"  §B[first] §IDX[xs] 0",
			"  §W[w1] n §K §SM var v → (+ v 1) §K _ → 0 §/W[w1]",
			"§/F[f1]",
			"§/M[m1]");

	@Test
	void everyChildLiesInsideItsParent()
	{
		ParseResult result = ParseResult.module(SHOP);
		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());

		List<String> violations = new ArrayList<>();
		int visited = walk(result.module, result.module, violations);

		assertTrue(violations.isEmpty(), violations::toString);
		assertTrue(visited > 60, "visited " + visited);
	}

	@Test
	void embeddedBoundsAreWalked()
	{
		ParseResult result = ParseResult.module(SHOP);
		ForStatement loop = (ForStatement) result.function().getBody().get(1);

		int from = SHOP.indexOf("(* n 2)");
		assertEquals(from, loop.getFrom().getSpan().getStart());
		assertEquals(from + "(* n 2)".length(), loop.getFrom().getSpan().getEnd());
		assertTrue(loop.getSpan().getStart() < from && from < loop.getSpan().getEnd());
	}

	/**
	 * Checks every node reachable from {@code holder} against {@code parent}, the nearest
	 * enclosing node. Holders that are not nodes themselves, such as function headers,
	 * are searched with the same parent.
	 *
	 * @return The number of nodes checked.
	 */
	private static int walk(ASTNode parent, Object holder, List<String> violations)
	{
		int count = 0;
		for (Object child : children(holder))
		{
			if (child instanceof ASTNode)
			{
				ASTNode node = (ASTNode) child;
				Span outer = parent.getSpan();
				Span inner = node.getSpan();
				if (inner.getStart() < outer.getStart() || inner.getEnd() > outer.getEnd())
				{
					violations.add(node.getClass().getSimpleName() + " " + inner + " outside "
							+ parent.getClass().getSimpleName() + " " + outer);
				}
				count += 1 + walk(node, node, violations);
			}
			else
			{
				count += walk(parent, child, violations);
			}
		}
		return count;
	}

	private static List<Object> children(Object holder)
	{
		List<Object> children = new ArrayList<>();
		for (Method method : holder.getClass().getMethods())
		{
			String name = method.getName();
			if (method.getParameterCount() != 0 || !name.startsWith("get")
					|| name.equals("getSpan") || name.equals("getAttributes") || name.equals("getClass"))
			{
				continue;
			}
			Object value;
			try
			{
				value = method.invoke(holder);
			}
			catch (ReflectiveOperationException e)
			{
				throw new AssertionError(method.toString(), e);
			}
			if (value instanceof List)
			{
				for (Object element : (List<?>) value)
				{
					if (isTreeObject(element))
					{
						children.add(element);
					}
				}
			}
			else if (isTreeObject(value))
			{
				children.add(value);
			}
		}
		return children;
	}

	private static boolean isTreeObject(Object value)
	{
		return value != null && !value.getClass().isEnum()
				&& value.getClass().getPackageName().startsWith("org.lokray.opal.ast");
	}
}
