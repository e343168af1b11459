package org.lokray.opal.parser;

import org.junit.jupiter.api.Test;
import org.lokray.opal.ast.declarations.*;
import org.lokray.opal.ast.expressions.*;
import org.lokray.opal.ast.statements.*;
import org.lokray.opal.util.DiagnosticCode;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpalParserTest
{
	@Test
	void minimalProgram()
	{
		ParseResult result = ParseResult.module("§M[m1:Demo] §F[f1:Main:pub] §R 42 §/F[f1] §/M[m1]");

		assertTrue(result.diagnostics.isEmpty());
		assertEquals("m1", result.module.getId());
		assertEquals("Demo", result.module.getName());
		assertEquals(1, result.module.getFunctions().size());

		FunctionDeclaration main = result.function();
		assertEquals("f1", main.getId());
		assertEquals("Main", main.getName());
		assertEquals(Visibility.PUBLIC, main.getVisibility());
		assertEquals(1, main.getBody().size());
		ReturnStatement ret = assertInstanceOf(ReturnStatement.class, main.getBody().get(0));
		assertEquals(42L, assertInstanceOf(IntLiteral.class, ret.getValue()).getValue());
	}

	@Test
	void verboseKeywordsParseTheSame()
	{
		ParseResult result = ParseResult.module(
				"§MODULE[id=m1 name=Demo] §FUNC[id=f1 name=Main visibility=pub] §RETURN 42 §END_FUNC[id=f1] §END_MODULE[id=m1]");
		assertTrue(result.diagnostics.isEmpty());
		assertEquals("Main", result.function().getName());
		assertEquals(Visibility.PUBLIC, result.function().getVisibility());
	}

	@Test
	void mismatchedCloseIdReportsOnceAndKeepsTheOpenId()
	{
		ParseResult result = ParseResult.module("§M[m1:Demo] §F[f1:Main] §R 1 §/F[f2] §/M[m1]");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.MISMATCHED_ID));
		assertEquals(1, result.diagnostics.size());
		assertEquals("f1", result.function().getId());
		String message = result.diagnostics.getDiagnostics().get(0).getMessage();
		assertTrue(message.contains("f1") && message.contains("f2"));
	}

	@Test
	void emptyModuleTagsReportBothMissingAttributes()
	{
		ParseResult result = ParseResult.module("§M §/M");

		assertEquals(2, result.diagnostics.count(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE));
		assertEquals(2, result.diagnostics.size());
		assertEquals("", result.module.getId());
		assertEquals("", result.module.getName());
	}

	@Test
	void missingModuleTagYieldsAnEmptyModule()
	{
		ParseResult result = ParseResult.module("§R 1");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.UNEXPECTED_TOKEN));
		assertEquals("", result.module.getId());
		assertTrue(result.module.getFunctions().isEmpty());
	}

	@Test
	void tokensAfterTheModuleAreReported()
	{
		ParseResult result = ParseResult.module("§M[m1:Demo] §/M[m1] leftover");
		assertEquals(1, result.diagnostics.count(DiagnosticCode.UNEXPECTED_TOKEN));
	}

	@Test
	void missingCloseTagIsReported()
	{
		ParseResult result = ParseResult.module("§M[m1:Demo] §F[f1:Main] §R 1 §/M[m1]");
		assertEquals(1, result.diagnostics.count(DiagnosticCode.UNEXPECTED_TOKEN));
		assertEquals(1, result.function().getBody().size());
	}

	@Test
	void usingDirectives()
	{
		ParseResult result = ParseResult.module("§M[m1:Demo] §U[System.IO] §U[static:System.Math] §/M[m1]");
		List<UsingDirective> usings = result.module.getUsings();
		assertEquals(2, usings.size());
		assertEquals("System.IO", usings.get(0).getNamespace());
		assertTrue(usings.get(1).isStatic());
	}

	@Test
	void functionHeader()
	{
		ParseResult result = ParseResult.module("§M[m1:Math] §F[f1:Add:pub] §I[i32:a] §I[i32:b] §O[i32] §E[cw] "
				+ "§Q (>= a 0) §S[\"positive\"] (> result 0) §R (+ a b) §/F[f1] §/M[m1]");

		assertTrue(result.diagnostics.isEmpty());
		FunctionHeader header = result.function().getHeader();
		assertEquals(2, header.getParameters().size());
		assertEquals("INT", header.getParameters().get(0).getType());
		assertEquals("b", header.getParameters().get(1).getName());
		assertEquals("INT", header.getOutput().getType());
		assertEquals(Map.of("io", "console_write"), header.getEffects().getEffects());
		assertEquals(1, header.getPreconditions().size());
		assertEquals("positive", header.getPostconditions().get(0).getMessage());

		ReturnStatement ret = assertInstanceOf(ReturnStatement.class, result.statement(0));
		assertEquals(BinaryOperator.ADD, assertInstanceOf(BinaryOperation.class, ret.getValue()).getOperator());
	}

	@Test
	void effectsAcrossGroups()
	{
		ParseResult result = ParseResult.body("§E[cw,fr][db] §R 0");
		assertEquals(Map.of("io", "console_write,file_read,database"),
				result.function().getHeader().getEffects().getEffects());
	}

	@Test
	void explicitBodyBlock()
	{
		ParseResult result = ParseResult.body("§I[i32:x] §BODY §P x §R x §END_BODY");
		assertTrue(result.diagnostics.isEmpty());
		assertEquals(2, result.statements().size());
	}

	@Test
	void typeParametersAndWhereClauses()
	{
		ParseResult result = ParseResult.module("§M[m1:Demo] §F[f1:Sort]<T, U> §WR[T:class:IComparable] "
				+ "§WHERE U : struct, new() §R 0 §/F[f1] §/M[m1]");

		assertTrue(result.diagnostics.isEmpty());
		List<TypeParameter> typeParameters = result.function().getHeader().getTypeParameters();
		assertEquals(2, typeParameters.size());

		List<TypeConstraint> first = typeParameters.get(0).getConstraints();
		assertEquals(ConstraintKind.CLASS, first.get(0).getKind());
		assertEquals(ConstraintKind.TYPE, first.get(1).getKind());
		assertEquals("IComparable", first.get(1).getTypeName());

		List<TypeConstraint> second = typeParameters.get(1).getConstraints();
		assertEquals(List.of(ConstraintKind.STRUCT, ConstraintKind.NEW),
				List.of(second.get(0).getKind(), second.get(1).getKind()));
	}

	@Test
	void typeParameterTagAndGenericConstraint()
	{
		ParseResult result = ParseResult.body("§TP[T] §WHERE T : IComparable<T> §R 0");
		TypeParameter typeParameter = result.function().getHeader().getTypeParameters().get(0);
		assertEquals("T", typeParameter.getName());
		assertEquals("IComparable<T>", typeParameter.getConstraints().get(0).getTypeName());
	}

	@Test
	void whereOnUndeclaredTypeParameter()
	{
		ParseResult result = ParseResult.body("§WR[X:class] §R 0");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.TYPE_PARAMETER_NOT_FOUND));
		assertTrue(result.function().getHeader().getTypeParameters().isEmpty());
	}

	@Test
	void callWithArguments()
	{
		ParseResult result = ParseResult.body("§C[Console.WriteLine] §A \"hi\" §A 2 §/C");
		CallStatement call = assertInstanceOf(CallStatement.class, result.statement(0));
		assertEquals("Console.WriteLine", call.getTarget());
		assertFalse(call.isFallible());
		assertEquals(2, call.getArguments().size());
		assertEquals("hi", assertInstanceOf(StringLiteral.class, call.getArguments().get(0)).getValue());
	}

	@Test
	void callWithOneImplicitArgument()
	{
		ParseResult result = ParseResult.body("§C[Console.WriteLine] \"hi\" §R 0");
		assertTrue(result.diagnostics.isEmpty());
		assertEquals(2, result.statements().size());
		assertEquals(1, ((CallStatement) result.statement(0)).getArguments().size());
	}

	@Test
	void syntaxVersionsOfACallAgree()
	{
		CallStatement compact = (CallStatement) ParseResult.body("§C[File.Read!] §A path §/C").statement(0);
		CallStatement verbose = (CallStatement) ParseResult.body("§CALL[target=File.Read fallible=true] §ARG path §END_CALL")
				.statement(0);

		assertEquals(compact.getTarget(), verbose.getTarget());
		assertTrue(compact.isFallible());
		assertTrue(verbose.isFallible());
		assertEquals(compact.getArguments().toString(), verbose.getArguments().toString());
	}

	@Test
	void callOnAnExpressionTarget()
	{
		ParseResult result = ParseResult.body("§C[] §NEW[Logger] §A \"x\" §/C");
		CallStatement call = assertInstanceOf(CallStatement.class, result.statement(0));
		assertTrue(result.diagnostics.isEmpty());
		assertEquals("", call.getTarget());
		assertInstanceOf(NewExpression.class, call.getTargetExpression());
		assertEquals(1, call.getArguments().size());
	}

	@Test
	void callWithoutTargetIsReported()
	{
		ParseResult result = ParseResult.body("§C[] §/C");
		assertEquals(1, result.diagnostics.count(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE));
	}

	@Test
	void bindStatement()
	{
		BindStatement bind = (BindStatement) ParseResult.body("§B[~total:i32] 0").statement(0);
		assertEquals("total", bind.getName());
		assertEquals("INT", bind.getType());
		assertTrue(bind.isMutable());
		assertInstanceOf(IntLiteral.class, bind.getInitializer());
	}

	@Test
	void forLoopBoundsFromAttributes()
	{
		ParseResult result = ParseResult.body("§L[l1:i:0:10] §P i §/L[l1]");
		ForStatement loop = assertInstanceOf(ForStatement.class, result.statement(0));

		assertTrue(result.diagnostics.isEmpty());
		assertEquals("i", loop.getVariable());
		assertEquals(0L, ((IntLiteral) loop.getFrom()).getValue());
		assertEquals(10L, ((IntLiteral) loop.getTo()).getValue());
		assertEquals(1L, ((IntLiteral) loop.getStep()).getValue());
		assertInstanceOf(PrintStatement.class, loop.getBody().get(0));
	}

	@Test
	void forLoopBoundWithEmbeddedExpression()
	{
		ForStatement loop = (ForStatement) ParseResult.body("§L[l1:i:0:(- n 1)] §/L[l1]").statement(0);
		BinaryOperation to = assertInstanceOf(BinaryOperation.class, loop.getTo());
		assertEquals(BinaryOperator.SUBTRACT, to.getOperator());
		assertEquals("n", ((ReferenceExpression) to.getLeft()).getName());
	}

	@Test
	void forLoopBoundsAsExpressions()
	{
		ForStatement loop = (ForStatement) ParseResult.body("§L[l1:i] 1 count §/L[l1]").statement(0);
		assertEquals(1L, ((IntLiteral) loop.getFrom()).getValue());
		assertEquals("count", ((ReferenceExpression) loop.getTo()).getName());
	}

	@Test
	void embeddedBoundKeepsItsSourcePosition()
	{
		String source = "§M[m1:Demo]\n§F[f1:Main]\n§I[i32:n]\n§L[l1:i:0:(- n 1)]\n§/L[l1]\n§/F[f1]\n§/M[m1]";
		ParseResult result = ParseResult.module(source);
		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());

		ForStatement loop = (ForStatement) result.statement(0);
		BinaryOperation to = assertInstanceOf(BinaryOperation.class, loop.getTo());
		int start = source.indexOf("(- n 1)");
		assertEquals(start, to.getSpan().getStart());
		assertEquals(start + "(- n 1)".length(), to.getSpan().getEnd());
		assertEquals(4, to.getSpan().getLine());
		assertEquals(11, to.getSpan().getColumn());
		assertEquals(source.indexOf("n 1)"), to.getLeft().getSpan().getStart());

		int from = source.indexOf(":0:") + 1;
		assertEquals(from, loop.getFrom().getSpan().getStart());
		assertTrue(loop.getSpan().getStart() <= to.getSpan().getStart());
	}

	@Test
	void tagOnlyNodesSpanTheirAttributes()
	{
		String source = "§M[m1:Demo] §U[System.Text] §F[f1:Main] §I[i32:n] §O[i32] §LK[agent7] §R n §/F[f1] §/M[m1]";
		ParseResult result = ParseResult.module(source);
		FunctionHeader header = result.function().getHeader();

		int parameter = source.indexOf("§I");
		assertEquals(parameter, header.getParameters().get(0).getSpan().getStart());
		assertEquals(parameter + "§I[i32:n]".length(), header.getParameters().get(0).getSpan().getEnd());
		assertEquals(source.indexOf("§O") + "§O[i32]".length(), header.getOutput().getSpan().getEnd());
		assertEquals(source.indexOf("§LK") + "§LK[agent7]".length(), header.getLock().getSpan().getEnd());
		assertEquals(source.indexOf("§U") + "§U[System.Text]".length(),
				result.module.getUsings().get(0).getSpan().getEnd());
	}

	@Test
	void nonExpressionBoundsUseLiteralRules()
	{
		ForStatement fractional = (ForStatement) ParseResult.body("§L[l1:x:0:1.5] §/L[l1]").statement(0);
		assertEquals(1.5, assertInstanceOf(FloatLiteral.class, fractional.getTo()).getValue());

		ParseResult result = ParseResult.body("§L[l1:i:10:0:-2] §/L[l1]");
		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());
		ForStatement countdown = (ForStatement) result.statement(0);
		assertEquals(-2L, assertInstanceOf(IntLiteral.class, countdown.getStep()).getValue());
		assertEquals(10L, assertInstanceOf(IntLiteral.class, countdown.getFrom()).getValue());
	}

	@Test
	void namedAttributesAreKeptOnTheNode()
	{
		ParseResult result = ParseResult.module(
				"§MODULE[id=m1 name=Demo] §FUNC[id=f1 name=Main visibility=pub] §RETURN 1 §END_FUNC[id=f1] §END_MODULE[id=m1]");
		Map<String, List<String>> attributes = result.function().getAttributes();

		assertEquals(List.of("f1"), attributes.get("id"));
		assertEquals(List.of("Main"), attributes.get("name"));
		assertEquals(List.of("pub"), attributes.get("visibility"));
		assertEquals(List.of("Demo"), result.module.getAttributes().get("name"));
		assertThrows(UnsupportedOperationException.class, () -> attributes.put("id", List.of("f2")));
		assertThrows(UnsupportedOperationException.class, () -> attributes.get("id").add("f2"));
	}

	@Test
	void positionalAttributesAreKeptOnTheNode()
	{
		ParseResult result = ParseResult.body("§B[~total:i32] 0 §L[l1:i:0:10] §/L[l1]");
		Map<String, List<String>> bind = result.statement(0).getAttributes();

		assertEquals(List.of("~total"), bind.get("_pos0"));
		assertEquals(List.of("i32"), bind.get("_pos1"));
		assertEquals(List.of("2"), bind.get("_posCount"));
		assertEquals(List.of("10"), result.statement(1).getAttributes().get("_pos3"));
		assertThrows(UnsupportedOperationException.class, () -> bind.remove("_pos0"));
	}

	@Test
	void nodesWithoutATagCarryNoAttributes()
	{
		ReturnStatement ret = (ReturnStatement) ParseResult.body("§R (+ 1 2)").statement(0);
		assertTrue(ret.getAttributes().isEmpty());
		assertTrue(ret.getValue().getAttributes().isEmpty());
	}

	@Test
	void ifWithBlocks()
	{
		ParseResult result = ParseResult.body("§IF[i1] (> x 0) §R 1 §EI (< x 0) §R -1 §EL §R 0 §/I[i1]");
		IfStatement statement = assertInstanceOf(IfStatement.class, result.statement(0));

		assertTrue(result.diagnostics.isEmpty());
		assertEquals("i1", statement.getId());
		assertEquals(1, statement.getThenBody().size());
		assertEquals(1, statement.getElseIfClauses().size());
		assertEquals(1, statement.getElseBody().size());
	}

	@Test
	void ifWithArrows()
	{
		ParseResult result = ParseResult.body("§IF[i1] (> x 0) → §R 1 §EL → §R 0 §/I[i1]");
		IfStatement statement = assertInstanceOf(IfStatement.class, result.statement(0));

		assertTrue(result.diagnostics.isEmpty());
		assertEquals(1, statement.getThenBody().size());
		assertTrue(statement.getElseIfClauses().isEmpty());
		assertEquals(1, statement.getElseBody().size());
	}

	@Test
	void ifWithoutElseHasNoElseBody()
	{
		IfStatement statement = (IfStatement) ParseResult.body("§IF[i1] flag §P 1 §/I[i1]").statement(0);
		assertNull(statement.getElseBody());
	}

	@Test
	void whileAndDoWhile()
	{
		ParseResult result = ParseResult.body("§WH[w1] (< i 3) §ASSIGN i (+ i 1) §/WH[w1] §DO[d1] §P i §/DO[d1] (< i 10)");
		assertTrue(result.diagnostics.isEmpty());

		WhileStatement loop = assertInstanceOf(WhileStatement.class, result.statement(0));
		assertInstanceOf(AssignmentStatement.class, loop.getBody().get(0));

		DoWhileStatement doWhile = assertInstanceOf(DoWhileStatement.class, result.statement(1));
		assertEquals(1, doWhile.getBody().size());
		assertInstanceOf(BinaryOperation.class, doWhile.getCondition());
	}

	@Test
	void foreachStatement()
	{
		ForeachStatement loop = (ForeachStatement) ParseResult.body("§EACH[e1:name:str] names §P name §/EACH[e1]")
				.statement(0);
		assertEquals("name", loop.getVariable());
		assertEquals("STRING", loop.getVariableType());
		assertEquals("names", ((ReferenceExpression) loop.getCollection()).getName());
	}

	@Test
	void tryCatchFinally()
	{
		ParseResult result = ParseResult.body(
				"§TR[t1] §C[Risky] §/C §CA[IOException:e] §WHEN (!= e null) §P e §CA §RT §FI §P \"done\" §/TR[t1]");
		TryStatement statement = assertInstanceOf(TryStatement.class, result.statement(0));

		assertTrue(result.diagnostics.isEmpty());
		assertEquals(1, statement.getBody().size());
		assertEquals(2, statement.getCatchClauses().size());

		CatchClause first = statement.getCatchClauses().get(0);
		assertEquals("IOException", first.getExceptionType());
		assertEquals("e", first.getVariable());
		assertNotNull(first.getFilter());

		CatchClause second = statement.getCatchClauses().get(1);
		assertNull(second.getExceptionType());
		assertInstanceOf(RethrowStatement.class, second.getBody().get(0));
		assertEquals(1, statement.getFinallyBody().size());
	}

	@Test
	void simpleStatements()
	{
		ParseResult result = ParseResult.body("§BK §CN §TH §NEW[Error] §Pf \"x\" §SUB btn.Click onClick §UNSUB btn.Click onClick");
		List<Statement> statements = result.statements();

		assertTrue(result.diagnostics.isEmpty());
		assertInstanceOf(BreakStatement.class, statements.get(0));
		assertInstanceOf(ContinueStatement.class, statements.get(1));
		assertInstanceOf(NewExpression.class, ((ThrowStatement) statements.get(2)).getException());
		assertFalse(((PrintStatement) statements.get(3)).isNewline());
		assertTrue(((EventSubscriptionStatement) statements.get(4)).isSubscribe());
		assertFalse(((EventSubscriptionStatement) statements.get(5)).isSubscribe());
	}

	@Test
	void leadingParenthesisIsAnExpressionStatement()
	{
		ExpressionStatement statement = (ExpressionStatement) ParseResult.body("(+ a 1)").statement(0);
		assertInstanceOf(BinaryOperation.class, statement.getExpression());
	}

	@Test
	void matchStatementWithArrowArms()
	{
		ParseResult result = ParseResult.body("§W[w1] code §K 1 → \"one\" §K _ → \"other\" §/W[w1]");
		MatchStatement match = assertInstanceOf(MatchStatement.class, result.statement(0));

		assertTrue(result.diagnostics.isEmpty());
		assertEquals(2, match.getCases().size());
		MatchCase first = match.getCases().get(0);
		assertNull(first.getGuard());
		ReturnStatement arm = assertInstanceOf(ReturnStatement.class, first.getBody().get(0));
		assertEquals("one", ((StringLiteral) arm.getValue()).getValue());
	}

	@Test
	void expressionFormMatchInStatementPositionReturnsTheMatch()
	{
		ParseResult result = ParseResult.body("§W[w1:expr] code §K _ → 0 §/W[w1]");
		ReturnStatement ret = assertInstanceOf(ReturnStatement.class, result.statement(0));
		assertInstanceOf(MatchExpression.class, ret.getValue());
	}

	@Test
	void unknownStatementTokenIsSkipped()
	{
		ParseResult result = ParseResult.body("] §R 1");
		assertEquals(1, result.diagnostics.count(DiagnosticCode.UNEXPECTED_TOKEN));
		assertEquals(1, result.statements().size());
	}

	@Test
	void strayBracketInExpressionPositionBecomesAMissingExpression()
	{
		ParseResult result = ParseResult.body("§P ] §R 1");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.UNEXPECTED_TOKEN));
		assertEquals(1, result.diagnostics.size());
		PrintStatement print = assertInstanceOf(PrintStatement.class, result.statement(0));
		assertInstanceOf(MissingExpression.class, print.getValue());
		assertInstanceOf(ReturnStatement.class, result.statement(1));
	}

	@Test
	void tagInExpressionPositionIsLeftForTheEnclosingConstruct()
	{
		ParseResult result = ParseResult.body("§P");

		assertEquals(1, result.diagnostics.size());
		assertInstanceOf(MissingExpression.class, ((PrintStatement) result.statement(0)).getValue());
		assertEquals("f1", result.function().getId());
	}

	@Test
	void nodeSpansCoverTheirSource()
	{
		ParseResult result = ParseResult.module("§M[m1:Demo] §F[f1:Main] §R 42 §/F[f1] §/M[m1]");
		FunctionDeclaration function = result.function();

		assertEquals(12, function.getSpan().getStart());
		assertEquals(12 + "§F[f1:Main] §R 42 §/F[f1]".length(), function.getSpan().getEnd());
		assertEquals(0, result.module.getSpan().getStart());
	}
}
