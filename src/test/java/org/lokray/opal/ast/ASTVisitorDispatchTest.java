package org.lokray.opal.ast;

import org.junit.jupiter.api.Test;
import org.lokray.opal.CompilationUnit;
import org.lokray.opal.OpalFrontEnd;
import org.lokray.opal.ast.declarations.*;
import org.lokray.opal.ast.expressions.DictionaryCreation;
import org.lokray.opal.ast.statements.BindStatement;
import org.lokray.opal.ast.statements.MatchStatement;
import org.lokray.opal.ast.statements.ReturnStatement;
import org.lokray.opal.ast.statements.Statement;

import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ASTVisitorDispatchTest
{
	/**
	 * A visitor whose every method answers with its own name.
	 */
	@SuppressWarnings("unchecked")
	private static final ASTVisitor<String> NAMES = (ASTVisitor<String>) Proxy.newProxyInstance(
			ASTVisitor.class.getClassLoader(), new Class<?>[]{ASTVisitor.class},
			(proxy, method, args) -> method.getName());

	private static void assertDispatches(ASTNode node)
	{
		assertNotNull(node);
		assertEquals("visit" + node.getClass().getSimpleName(), node.accept(NAMES));
	}

	@Test
	void everyParsedNodeKindDispatchesToItsOwnMethod()
	{
		CompilationUnit unit = new OpalFrontEnd().parse(String.join("\n",
				"§M[m1:Shop]",
				"§U[System]",
				"§CL[c1:Cart] §FLD[i32:count] §PROP[p1:Size:i32] §GET §R count §/GET §/PROP[p1]",
				"  §CTOR[k1] §ASSIGN count 0 §/CTOR[k1] §MT[mt1:Clear] §ASSIGN count 0 §/MT[mt1] §/CL[c1]",
				"§F[f1:Main] §I[i32:n] §O[i32] §Q (> n 0)",
				"  §W[w1] n §K §SM var v → (+ v 1) §K _ → 0 §/W[w1]",
				"§/F[f1]",
				"§/M[m1]"));
		assertFalse(unit.hasErrors(), () -> unit.diagnostics().getDiagnostics().toString());

		ModuleDeclaration module = unit.module();
		ClassDeclaration cart = module.getClasses().get(0);
		FunctionDeclaration main = module.getFunctions().get(0);
		MatchStatement match = (MatchStatement) main.getBody().get(0);

		List<ASTNode> nodes = new ArrayList<>();
		nodes.add(module);
		nodes.add(module.getUsings().get(0));
		nodes.add(cart);
		nodes.add(cart.getFields().get(0));
		nodes.add(cart.getProperties().get(0));
		nodes.add(cart.getProperties().get(0).getGetter());
		nodes.add(cart.getConstructors().get(0));
		nodes.add(cart.getMethods().get(0));
		nodes.add(main);
		nodes.add(main.getHeader().getParameters().get(0));
		nodes.add(main.getHeader().getOutput());
		nodes.add(main.getHeader().getPreconditions().get(0));
		nodes.add(main.getHeader().getPreconditions().get(0).getCondition());
		nodes.add(match);
		nodes.add(match.getTarget());
		nodes.add(match.getCases().get(0));
		nodes.add(match.getCases().get(0).getPattern());
		nodes.add(match.getCases().get(1).getPattern());
		nodes.add(((ReturnStatement) match.getCases().get(0).getBody().get(0)).getValue());
		nodes.add(match.getCases().get(1).getBody().get(0));

		for (ASTNode node : nodes)
		{
			assertDispatches(node);
		}
	}

	@Test
	void typeDefinitionsCollectionsAndMetadataDispatch()
	{
		CompilationUnit unit = new OpalFrontEnd().parse(String.join("\n",
				"§M[m1:Shop]",
				"§D[d1:Point] §FL[x:i32] §/D[d1]",
				"§T[t1:Shape] §V[Empty] §/T[t1]",
				"§EN[e1:Color] Red §/EN[e1]",
				"§EEXT[x1:Color] §/EEXT[x1]",
				"§DEL[dl1:Handler] §O[bool] §/DEL[dl1]",
				"§CL[c1:Cart] §EVT[ev1:Changed:pub:Handler] §/CL[c1]",
				"§F[f1:Items] §O[i32] §EX (+ 1 2) → 3 §US[Helper] §SN[1.0] §DP[1.2:NewItems]",
				"  §LIST[xs:i32] 1 §/LIST[xs]",
				"  §DICT[ages:str:i32] §KV \"a\" 1 §/DICT[ages]",
				"  §PUSH[xs] 2",
				"  §PUT[ages] \"b\" 2",
				"  §REM[xs] 1",
				"  §SETIDX[xs] 0 5",
				"  §INS[xs] 0 4",
				"  §CLR[ages]",
				"  §B[found] §HAS[xs] 2",
				"  §B[size] §CNT[xs]",
				"  §B[tags] §HSET[t1:str] \"a\" §/HSET[t1]",
				"  §YIELD 1",
				"  §YBRK",
				"§/F[f1]",
				"§/M[m1]"));
		assertFalse(unit.hasErrors(), () -> unit.diagnostics().getDiagnostics().toString());

		ModuleDeclaration module = unit.module();
		FunctionDeclaration items = module.getFunctions().get(0);
		FunctionHeader header = items.getHeader();
		List<Statement> body = items.getBody();
		DictionaryCreation ages = (DictionaryCreation) ((BindStatement) body.get(1)).getInitializer();

		List<ASTNode> nodes = new ArrayList<>();
		nodes.add(module.getRecords().get(0));
		nodes.add(module.getRecords().get(0).getFields().get(0));
		nodes.add(module.getUnions().get(0));
		nodes.add(module.getUnions().get(0).getVariants().get(0));
		nodes.add(module.getEnums().get(0));
		nodes.add(module.getEnums().get(0).getMembers().get(0));
		nodes.add(module.getEnumExtensions().get(0));
		nodes.add(module.getDelegates().get(0));
		nodes.add(module.getClasses().get(0).getEvents().get(0));
		nodes.add(header.getExamples().get(0));
		nodes.add(header.getUses());
		nodes.add(header.getUses().getDependencies().get(0));
		nodes.add(header.getSince());
		nodes.add(header.getDeprecated());
		nodes.add(((BindStatement) body.get(0)).getInitializer());
		nodes.add(ages);
		nodes.add(ages.getEntries().get(0));
		for (int i = 2; i <= 7; i++)
		{
			nodes.add(body.get(i));
		}
		nodes.add(((BindStatement) body.get(8)).getInitializer());
		nodes.add(((BindStatement) body.get(9)).getInitializer());
		nodes.add(((BindStatement) body.get(10)).getInitializer());
		nodes.add(body.get(11));
		nodes.add(body.get(12));

		for (ASTNode node : nodes)
		{
			assertDispatches(node);
		}
	}
}
