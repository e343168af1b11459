package org.lokray.opal.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.lokray.opal.ast.expressions.*;
import org.lokray.opal.util.DiagnosticCode;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest
{
	@Test
	void binaryFormFoldsToTheLeftAndSharesTheFormSpan()
	{
		ParseResult result = ParseResult.expression("(+ 1 2 3)");

		assertTrue(result.diagnostics.isEmpty());
		BinaryOperation outer = assertInstanceOf(BinaryOperation.class, result.expression);
		assertEquals(BinaryOperator.ADD, outer.getOperator());
		assertEquals(3L, assertInstanceOf(IntLiteral.class, outer.getRight()).getValue());

		BinaryOperation inner = assertInstanceOf(BinaryOperation.class, outer.getLeft());
		assertEquals(1L, assertInstanceOf(IntLiteral.class, inner.getLeft()).getValue());
		assertEquals(2L, assertInstanceOf(IntLiteral.class, inner.getRight()).getValue());

		assertEquals(0, outer.getSpan().getStart());
		assertEquals(9, outer.getSpan().getEnd());
		assertEquals(outer.getSpan(), inner.getSpan());
	}

	@ParameterizedTest
	@CsvSource({
			"'(- x)', NEGATE",
			"'(! flag)', NOT",
			"'(not flag)', NOT",
			"'(~ mask)', BIT_NOT"
	})
	void singleOperandFormsAreUnary(String source, UnaryOperator expected)
	{
		ParseResult result = ParseResult.expression(source);

		assertTrue(result.diagnostics.isEmpty());
		UnaryOperation unary = assertInstanceOf(UnaryOperation.class, result.expression);
		assertEquals(expected, unary.getOperator());
		assertInstanceOf(ReferenceExpression.class, unary.getOperand());
	}

	@ParameterizedTest
	@CsvSource({
			"'(and a b)', AND",
			"'(or a b)', OR",
			"'(lte a b)', LESS_OR_EQUAL",
			"'(eq a b)', EQUAL",
			"'(mod a b)', MODULO",
			"'(<= a b)', LESS_OR_EQUAL",
			"'(** a b)', POWER",
			"'(<< a b)', SHIFT_LEFT"
	})
	void wordAndSymbolOperatorsResolve(String source, BinaryOperator expected)
	{
		ParseResult result = ParseResult.expression(source);

		assertTrue(result.diagnostics.isEmpty());
		assertEquals(expected, assertInstanceOf(BinaryOperation.class, result.expression).getOperator());
	}

	@Test
	void binaryOperatorWithOneOperandFallsBackToIt()
	{
		ParseResult result = ParseResult.expression("(+ 1)");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.OPERATOR_ARGUMENT_COUNT));
		assertEquals(1L, assertInstanceOf(IntLiteral.class, result.expression).getValue());
	}

	@Test
	void unknownOperatorIsReported()
	{
		ParseResult result = ParseResult.expression("(frob 1 2)");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.INVALID_OPERATOR));
		assertEquals(1L, assertInstanceOf(IntLiteral.class, result.expression).getValue());
	}

	@Test
	void emptyUnknownFormBecomesZero()
	{
		ParseResult result = ParseResult.expression("(frob)");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.INVALID_OPERATOR));
		IntLiteral zero = assertInstanceOf(IntLiteral.class, result.expression);
		assertEquals(0L, zero.getValue());
		assertEquals(0, zero.getSpan().getStart());
		assertEquals(6, zero.getSpan().getEnd());
	}

	@Test
	void conditionalNeedsThreeOperands()
	{
		ParseResult ok = ParseResult.expression("(? c 1 2)");
		ConditionalExpression conditional = assertInstanceOf(ConditionalExpression.class, ok.expression);
		assertEquals("c", assertInstanceOf(ReferenceExpression.class, conditional.getCondition()).getName());
		assertEquals(2L, assertInstanceOf(IntLiteral.class, conditional.getWhenFalse()).getValue());
		assertTrue(ok.diagnostics.isEmpty());

		ParseResult bad = ParseResult.expression("(? c 1)");
		assertEquals(1, bad.diagnostics.count(DiagnosticCode.OPERATOR_ARGUMENT_COUNT));
		assertInstanceOf(ReferenceExpression.class, bad.expression);
	}

	@Test
	void nullCoalesceFormChains()
	{
		ParseResult result = ParseResult.expression("(?? a b c)");

		NullCoalesce outer = assertInstanceOf(NullCoalesce.class, result.expression);
		assertEquals("c", assertInstanceOf(ReferenceExpression.class, outer.getRight()).getName());
		NullCoalesce inner = assertInstanceOf(NullCoalesce.class, outer.getLeft());
		assertEquals("a", assertInstanceOf(ReferenceExpression.class, inner.getLeft()).getName());
		assertTrue(result.diagnostics.isEmpty());
	}

	@Test
	void memberAccessAfterAFormWrapsIt()
	{
		ParseResult result = ParseResult.expression("(+ a b).Length");

		FieldAccess access = assertInstanceOf(FieldAccess.class, result.expression);
		assertEquals("Length", access.getMember());
		assertInstanceOf(BinaryOperation.class, access.getTarget());
		assertEquals(14, access.getSpan().getEnd());
	}

	@Test
	void dottedIdentifierStaysOneReference()
	{
		ParseResult result = ParseResult.expression("order.Total");

		assertEquals("order.Total", assertInstanceOf(ReferenceExpression.class, result.expression).getName());
	}

	@Test
	void nullConditionalTag()
	{
		ParseResult result = ParseResult.expression("§?. customer Name");

		assertTrue(result.diagnostics.isEmpty());
		NullConditional access = assertInstanceOf(NullConditional.class, result.expression);
		assertEquals("Name", access.getMember());
		assertEquals("customer", assertInstanceOf(ReferenceExpression.class, access.getTarget()).getName());
	}

	@Test
	void indexFromEndAndRange()
	{
		IndexFromEnd fromEnd = assertInstanceOf(IndexFromEnd.class, ParseResult.expression("§^ 1").expression);
		assertEquals(1L, assertInstanceOf(IntLiteral.class, fromEnd.getOffset()).getValue());

		RangeExpression range = assertInstanceOf(RangeExpression.class, ParseResult.expression("§RANGE 1 5").expression);
		assertEquals(5L, assertInstanceOf(IntLiteral.class, range.getEnd()).getValue());

		RangeExpression open = assertInstanceOf(RangeExpression.class, ParseResult.expression("§RANGE").expression);
		assertNull(open.getStart());
		assertNull(open.getEnd());
	}

	@Test
	void lambdaWithExpressionBody()
	{
		ParseResult result = ParseResult.expression("§LAM[l1:x:i32] (* x 2) §/LAM[l1]");

		assertTrue(result.diagnostics.isEmpty());
		LambdaExpression lambda = assertInstanceOf(LambdaExpression.class, result.expression);
		assertEquals("l1", lambda.getId());
		assertFalse(lambda.isAsync());
		assertEquals(1, lambda.getParameters().size());
		assertEquals("x", lambda.getParameters().get(0).getName());
		assertEquals("INT", lambda.getParameters().get(0).getType());
		assertInstanceOf(BinaryOperation.class, lambda.getExpressionBody());
		assertTrue(lambda.getStatementBody().isEmpty());
	}

	@Test
	void asyncLambdaWithStatementBody()
	{
		ParseResult result = ParseResult.expression("§LAM[l2:async:n] §R n §/LAM[l2]");

		assertTrue(result.diagnostics.isEmpty());
		LambdaExpression lambda = assertInstanceOf(LambdaExpression.class, result.expression);
		assertTrue(lambda.isAsync());
		assertNull(lambda.getParameters().get(0).getType());
		assertNull(lambda.getExpressionBody());
		assertEquals(1, lambda.getStatementBody().size());
	}

	@Test
	void newWithGenericTypeArgumentsAndInitializers()
	{
		ParseResult result = ParseResult.expression("§NEW[List<i32>] §A 4 Capacity = 8 §/NEW");

		assertTrue(result.diagnostics.isEmpty());
		NewExpression created = assertInstanceOf(NewExpression.class, result.expression);
		assertEquals("List", created.getTypeName());
		assertEquals(1, created.getTypeArguments().size());
		assertEquals("i32", created.getTypeArguments().get(0));
		assertEquals(1, created.getArguments().size());
		assertEquals(1, created.getInitializers().size());
		assertEquals("Capacity", created.getInitializers().get(0).getName());
	}

	@Test
	void interpolatedStringKeepsTextAndExpressionParts()
	{
		ParseResult result = ParseResult.expression("§INTERP \"Hello \" §EXP name \"!\" §/INTERP");

		assertTrue(result.diagnostics.isEmpty());
		InterpolatedString text = assertInstanceOf(InterpolatedString.class, result.expression);
		assertEquals(3, text.getParts().size());
		assertEquals("Hello ", text.getParts().get(0).getText());
		assertNull(text.getParts().get(0).getExpression());
		assertInstanceOf(ReferenceExpression.class, text.getParts().get(1).getExpression());
		assertEquals("!", text.getParts().get(2).getText());
	}

	@Test
	void fixedSizeArray()
	{
		ParseResult result = ParseResult.expression("§ARR[a1:i32:10]");

		ArrayCreation array = assertInstanceOf(ArrayCreation.class, result.expression);
		assertEquals("a1", array.getId());
		assertEquals("INT", array.getElementType());
		assertEquals(10L, assertInstanceOf(IntLiteral.class, array.getSize()).getValue());
		assertTrue(array.getElements().isEmpty());
	}

	@Test
	void typeFirstArraySlotsAreSwapped()
	{
		ArrayCreation array = assertInstanceOf(ArrayCreation.class, ParseResult.expression("§ARR[str:names:3]").expression);

		assertEquals("names", array.getId());
		assertEquals("STRING", array.getElementType());
	}

	@Test
	void initializedArray()
	{
		ParseResult result = ParseResult.expression("§ARR[a1:i32] §A 1 §A 2 §A 3 §/ARR[a1]");

		assertTrue(result.diagnostics.isEmpty());
		ArrayCreation array = assertInstanceOf(ArrayCreation.class, result.expression);
		assertNull(array.getSize());
		assertEquals(3, array.getElements().size());
	}

	@Test
	void recordCreation()
	{
		ParseResult result = ParseResult.expression("§D[Point] §FL[X] 1 §FL[Y] 2 §/D");

		assertTrue(result.diagnostics.isEmpty());
		RecordCreation record = assertInstanceOf(RecordCreation.class, result.expression);
		assertEquals("Point", record.getTypeName());
		assertEquals(2, record.getFields().size());
		assertEquals("Y", record.getFields().get(1).getName());
	}

	@Test
	void optionValues()
	{
		SomeExpression some = assertInstanceOf(SomeExpression.class, ParseResult.expression("§SM 5").expression);
		assertEquals(5L, assertInstanceOf(IntLiteral.class, some.getValue()).getValue());

		NoneExpression typed = assertInstanceOf(NoneExpression.class, ParseResult.expression("§NN[i32]").expression);
		assertEquals("INT", typed.getTypeName());

		NoneExpression untyped = assertInstanceOf(NoneExpression.class, ParseResult.expression("§NN").expression);
		assertNull(untyped.getTypeName());
	}

	@Test
	void withExpressionCollectsAssignments()
	{
		ParseResult result = ParseResult.expression("§WITH point §SET[X] 3 §/WITH");

		assertTrue(result.diagnostics.isEmpty());
		WithExpression with = assertInstanceOf(WithExpression.class, result.expression);
		assertEquals(1, with.getAssignments().size());
		assertEquals("X", with.getAssignments().get(0).getName());
	}

	@Test
	void trailingTokensAfterAStandaloneExpressionAreReported()
	{
		ParseResult result = ParseResult.expression("1 2");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.UNEXPECTED_TOKEN));
		assertInstanceOf(IntLiteral.class, result.expression);
	}
}
