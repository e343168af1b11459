package org.lokray.opal.parser;

import org.junit.jupiter.api.Test;
import org.lokray.opal.ast.declarations.*;
import org.lokray.opal.ast.expressions.IntLiteral;
import org.lokray.opal.util.DiagnosticCode;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TypeDefinitionParserTest
{
	private static final String GEOMETRY = String.join("\n",
			"§M[m1:Geometry]",
			"§D[d1:Point]",
			"  §FL[x:i32]",
			"  §FL[y:i32] = 0",
			"§/D[d1]",
			"§T[t1:Shape]",
			"  §V[Circle] §FL[radius:f64]",
			"  §V[Rect] §FL[w:f64] §FL[h:f64]",
			"  §V[Empty]",
			"§/T[t1]",
			"§EN[e1:Level:i32]",
			"  Low = -1",
			"  Mid",
			"  High = 1",
			"  Default = Mid",
			"§/EN[e1]",
			"§EEXT[x1:Level]",
			"  §F[f1:IsHigh] §I[Level:level] §O[bool] §R (== level 1) §/F[f1]",
			"§/EEXT[x1]",
			"§DEL[dl1:Resize:pub] §I[f64:factor] §O[void] §E[cw] §/DEL[dl1]",
			"§/M[m1]");

	private static ModuleDeclaration geometry()
	{
		ParseResult result = ParseResult.module(GEOMETRY);
		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());
		return result.module;
	}

	@Test
	void recordWithFieldsAndDefault()
	{
		List<RecordDefinition> records = geometry().getRecords();
		assertEquals(1, records.size());

		RecordDefinition point = records.get(0);
		assertEquals("d1", point.getId());
		assertEquals("Point", point.getName());
		assertEquals(2, point.getFields().size());

		FieldDefinition x = point.getFields().get(0);
		assertEquals("x", x.getName());
		assertEquals("INT", x.getType());
		assertNull(x.getDefaultValue());

		FieldDefinition y = point.getFields().get(1);
		assertEquals(0L, assertInstanceOf(IntLiteral.class, y.getDefaultValue()).getValue());
	}

	@Test
	void unionVariantsKeepTheirFields()
	{
		UnionDefinition shape = geometry().getUnions().get(0);

		assertEquals("t1", shape.getId());
		assertEquals("Shape", shape.getName());
		assertEquals(List.of("Circle", "Rect", "Empty"),
				shape.getVariants().stream().map(VariantDefinition::getName).collect(Collectors.toList()));
		assertEquals(1, shape.getVariants().get(0).getFields().size());
		assertEquals("h", shape.getVariants().get(1).getFields().get(1).getName());
		assertTrue(shape.getVariants().get(2).getFields().isEmpty());
	}

	@Test
	void enumMembersAndValues()
	{
		EnumDefinition level = geometry().getEnums().get(0);

		assertEquals("e1", level.getId());
		assertEquals("Level", level.getName());
		assertEquals("INT", level.getUnderlyingType());

		List<EnumMember> members = level.getMembers();
		assertEquals(4, members.size());
		assertEquals("Low", members.get(0).getName());
		assertEquals("-1", members.get(0).getValue());
		assertNull(members.get(1).getValue());
		assertEquals("1", members.get(2).getValue());
		assertEquals("Mid", members.get(3).getValue());
	}

	@Test
	void enumExtensionHoldsFunctions()
	{
		EnumExtension extension = geometry().getEnumExtensions().get(0);

		assertEquals("x1", extension.getId());
		assertEquals("Level", extension.getEnumName());
		assertEquals(1, extension.getFunctions().size());
		assertEquals("IsHigh", extension.getFunctions().get(0).getName());
	}

	@Test
	void delegateSignature()
	{
		DelegateDefinition resize = geometry().getDelegates().get(0);

		assertEquals("dl1", resize.getId());
		assertEquals("Resize", resize.getName());
		assertEquals("factor", resize.getParameters().get(0).getName());
		assertEquals("VOID", resize.getOutput().getType());
		assertNotNull(resize.getEffects());
	}

	@Test
	void enumWithoutUnderlyingType()
	{
		ParseResult result = ParseResult.module("§M[m1:Colors] §EN[e1:Color] Red Green §/EN[e1] §/M[m1]");

		assertTrue(result.diagnostics.isEmpty());
		EnumDefinition color = result.module.getEnums().get(0);
		assertNull(color.getUnderlyingType());
		assertEquals(2, color.getMembers().size());
	}

	@Test
	void recordWithoutIdIsReported()
	{
		ParseResult result = ParseResult.module("§M[m1:Geometry] §D §FL[x:i32] §/D §/M[m1]");

		assertTrue(result.diagnostics.count(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE) >= 1);
		assertEquals(1, result.module.getRecords().size());
		assertEquals(1, result.module.getRecords().get(0).getFields().size());
	}

	@Test
	void fieldWithoutTypeIsReported()
	{
		ParseResult result = ParseResult.module("§M[m1:Geometry] §D[d1:Point] §FL[x] §/D[d1] §/M[m1]");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE));
	}

	@Test
	void mismatchedUnionCloseNamesBothIds()
	{
		ParseResult result = ParseResult.module("§M[m1:Geometry] §T[t1:Shape] §V[Empty] §/T[t2] §/M[m1]");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.MISMATCHED_ID));
		String message = result.diagnostics.getDiagnostics().get(0).getMessage();
		assertTrue(message.contains("'t1'") && message.contains("'t2'"), message);
	}

	@Test
	void strayTokenInsideRecordIsReported()
	{
		ParseResult result = ParseResult.module("§M[m1:Geometry] §D[d1:Point] 42 §FL[x:i32] §/D[d1] §/M[m1]");

		assertEquals(1, result.diagnostics.count(DiagnosticCode.UNEXPECTED_TOKEN));
		assertEquals(1, result.module.getRecords().get(0).getFields().size());
	}

	@Test
	void eventInsideAClass()
	{
		ParseResult result = ParseResult.module(
				"§M[m1:Ui] §CL[c1:Button] §EVT[ev1:Clicked:pub:ClickHandler] §/CL[c1] §/M[m1]");

		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());
		EventDefinition clicked = result.module.getClasses().get(0).getEvents().get(0);
		assertEquals("ev1", clicked.getId());
		assertEquals("Clicked", clicked.getName());
		assertEquals(Visibility.PUBLIC, clicked.getVisibility());
		assertEquals("ClickHandler", clicked.getDelegateType());
	}
}
