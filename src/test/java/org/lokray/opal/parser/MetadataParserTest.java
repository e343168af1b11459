package org.lokray.opal.parser;

import org.junit.jupiter.api.Test;
import org.lokray.opal.ast.declarations.*;
import org.lokray.opal.ast.expressions.BinaryOperation;
import org.lokray.opal.ast.expressions.BinaryOperator;
import org.lokray.opal.ast.expressions.IntLiteral;
import org.lokray.opal.util.DiagnosticCode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetadataParserTest
{
	private static final String STORE = String.join("\n",
			"§M[m1:Store]",
			"§TD[t1:perf:high] \"Cache lookups\"",
			"§FX \"Off by one in paging\"",
			"§HK[h1] \"Retry until the lock clears\"",
			"§AS[env] \"Runs with a writable temp directory\"",
			"§IV[positive] (> count 0)",
			"§DC[d1] \"Storage engine\"",
			"  §CHOSEN \"sqlite\" §REASON \"embedded\"",
			"  §REJECTED \"postgres\" §REASON \"needs a server\" §REASON \"ops cost\"",
			"  §CT \"single user desktop\"",
			"  §AU \"alice\"",
			"§/DC[d1]",
			"§CT[partial]",
			"  §VS §FILE[src/a.cs] \"entry point\" §/VS",
			"  §HD §FILE[src/b.cs] §/HD",
			"  §FC[Main]",
			"  §FILE[README.md]",
			"§/CT",
			"§/M[m1]");

	private static ModuleDeclaration store()
	{
		ParseResult result = ParseResult.module(STORE);
		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());
		return result.module;
	}

	@Test
	void issuesKeepKindIdCategoryAndPriority()
	{
		List<IssueDeclaration> issues = store().getIssues();
		assertEquals(3, issues.size());

		IssueDeclaration todo = issues.get(0);
		assertEquals(IssueKind.TODO, todo.getKind());
		assertEquals("t1", todo.getId());
		assertEquals("perf", todo.getCategory());
		assertEquals(IssuePriority.HIGH, todo.getPriority());
		assertEquals("Cache lookups", todo.getDescription());

		IssueDeclaration fixme = issues.get(1);
		assertEquals(IssueKind.FIXME, fixme.getKind());
		assertNull(fixme.getId());
		assertEquals(IssuePriority.MEDIUM, fixme.getPriority());

		assertEquals(IssueKind.HACK, issues.get(2).getKind());
		assertEquals("h1", issues.get(2).getId());
	}

	@Test
	void assumptionAndInvariant()
	{
		ModuleDeclaration module = store();

		AssumptionDeclaration assumption = module.getAssumptions().get(0);
		assertEquals(AssumptionCategory.ENVIRONMENT, assumption.getCategory());
		assertEquals("Runs with a writable temp directory", assumption.getText());

		InvariantDeclaration invariant = module.getInvariants().get(0);
		assertEquals("positive", invariant.getMessage());
		BinaryOperation condition = assertInstanceOf(BinaryOperation.class, invariant.getCondition());
		assertEquals(BinaryOperator.GREATER, condition.getOperator());
	}

	@Test
	void decisionRecord()
	{
		DecisionDeclaration decision = store().getDecisions().get(0);

		assertEquals("d1", decision.getId());
		assertEquals("Storage engine", decision.getTitle());
		assertEquals("sqlite", decision.getChosen());
		assertEquals("embedded", decision.getChosenReason());
		assertEquals("single user desktop", decision.getContext());
		assertEquals("alice", decision.getAuthor());

		assertEquals(1, decision.getRejected().size());
		RejectedOption rejected = decision.getRejected().get(0);
		assertEquals("postgres", rejected.getName());
		assertEquals(List.of("needs a server", "ops cost"), rejected.getReasons());
	}

	@Test
	void contextBlock()
	{
		ContextDeclaration context = store().getContext();

		assertTrue(context.isPartial());
		assertEquals(1, context.getVisibleFiles().size());
		assertEquals("src/a.cs", context.getVisibleFiles().get(0).getPath());
		assertEquals("entry point", context.getVisibleFiles().get(0).getDescription());
		assertEquals("src/b.cs", context.getHiddenFiles().get(0).getPath());
		assertNull(context.getHiddenFiles().get(0).getDescription());
		assertEquals("Main", context.getFocus());
		assertEquals("README.md", context.getFiles().get(0).getPath());
	}

	@Test
	void functionHeaderMetadata()
	{
		ParseResult result = ParseResult.module(String.join("\n",
				"§M[m1:Store]",
				"§F[f1:Save:pub]",
				"  §I[i32:amount]",
				"  §Q[positive] (> amount 0)",
				"  §S (>= amount 0)",
				"  §AS[data] \"Amounts fit in 32 bits\"",
				"  §LK[agent7]",
				"  §AU[agent7:task12]",
				"  §R amount",
				"§/F[f1]",
				"§/M[m1]"));

		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());
		FunctionHeader header = result.function().getHeader();
		assertEquals("positive", header.getPreconditions().get(0).getMessage());
		assertNull(header.getPostconditions().get(0).getMessage());
		assertEquals(AssumptionCategory.DATA, header.getAssumptions().get(0).getCategory());
		assertEquals("agent7", header.getLock().getAgent());
		assertEquals("agent7", header.getAuthor().getAgent());
		assertEquals("task12", header.getAuthor().getTask());
		assertEquals(1, result.function().getBody().size());
	}

	@Test
	void emptyLockFallsBackToUnknown()
	{
		ParseResult result = ParseResult.module("§M[m1:Store] §F[f1:Save] §LK §R 0 §/F[f1] §/M[m1]");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE));
		assertEquals("unknown", result.function().getHeader().getLock().getAgent());
	}

	@Test
	void issueWithoutDescriptionIsReported()
	{
		ParseResult result = ParseResult.module("§M[m1:Store] §TD[t1] §/M[m1]");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE));
		assertEquals("", result.module.getIssues().get(0).getDescription());
	}

	@Test
	void examplesUsesSinceAndDeprecation()
	{
		ParseResult result = ParseResult.module(String.join("\n",
				"§M[m1:Store]",
				"§F[f1:Add:pub]",
				"  §I[i32:a] §I[i32:b] §O[i32]",
				"  §EX[ex1:sums] (+ 2 3) → 5",
				"  §EX (+ 0 0) → 0",
				"  §US[Ledger, Audit?, Clock@2.1]",
				"  §SN[1.0]",
				"  §DP[1.4:AddChecked]",
				"  §R (+ a b)",
				"§/F[f1]",
				"§/M[m1]"));

		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());
		FunctionHeader header = result.function().getHeader();

		assertEquals(2, header.getExamples().size());
		ExampleDeclaration sums = header.getExamples().get(0);
		assertEquals("ex1", sums.getId());
		assertEquals("sums", sums.getMessage());
		assertInstanceOf(BinaryOperation.class, sums.getExpression());
		assertEquals(5L, assertInstanceOf(IntLiteral.class, sums.getExpected()).getValue());
		assertNull(header.getExamples().get(1).getId());

		List<Dependency> dependencies = header.getUses().getDependencies();
		assertEquals(3, dependencies.size());
		assertEquals("Ledger", dependencies.get(0).getTarget());
		assertFalse(dependencies.get(0).isOptional());
		assertEquals("Audit", dependencies.get(1).getTarget());
		assertTrue(dependencies.get(1).isOptional());
		assertEquals("Clock", dependencies.get(2).getTarget());
		assertEquals("2.1", dependencies.get(2).getVersion());

		assertEquals("1.0", header.getSince().getVersion());
		assertEquals("1.4", header.getDeprecated().getSince());
		assertEquals("AddChecked", header.getDeprecated().getReplacement());
		assertEquals(1, result.function().getBody().size());
	}

	@Test
	void sinceWithoutVersionIsReported()
	{
		ParseResult result = ParseResult.module("§M[m1:Store] §F[f1:Save] §SN §R 0 §/F[f1] §/M[m1]");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE));
		assertEquals("0.0.0", result.function().getHeader().getSince().getVersion());
		assertEquals(1, result.function().getBody().size());
	}

	@Test
	void exampleWithoutArrowIsReported()
	{
		ParseResult result = ParseResult.module("§M[m1:Store] §F[f1:Save] §EX (+ 1 1) 2 §R 0 §/F[f1] §/M[m1]");

		assertTrue(result.diagnostics.hasErrors());
		assertEquals(1, result.function().getHeader().getExamples().size());
	}
}
