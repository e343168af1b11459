package org.lokray.opal.parser;

import org.junit.jupiter.api.Test;
import org.lokray.opal.ast.declarations.*;
import org.lokray.opal.ast.expressions.BinaryOperation;
import org.lokray.opal.ast.expressions.IntLiteral;
import org.lokray.opal.ast.expressions.StringLiteral;
import org.lokray.opal.ast.statements.AssignmentStatement;
import org.lokray.opal.ast.statements.ReturnStatement;
import org.lokray.opal.util.DiagnosticCode;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClassParserTest
{
	private static final String ACCOUNT = String.join("\n",
			"§M[m1:Bank]",
			"§CL[c1:Account:Entity:seal]",
			"  §IMPL[IAccount]",
			"  §FLD[i32:balance:pri] = 0",
			"  §PROP[p1:Balance:i32:pub]",
			"    §GET §R balance §/GET",
			"    §SET[pri] §ASSIGN balance value §/SET",
			"  §/PROP[p1]",
			"  §CTOR[k1:pub] §I[i32:start]",
			"    §BASE §A \"acct\" §/BASE",
			"    §ASSIGN balance start",
			"  §/CTOR[k1]",
			"  §MT[mt1:Deposit:pub:virt] §I[i32:amount] §O[void]",
			"    §ASSIGN balance (+ balance amount)",
			"  §/MT[mt1]",
			"§/CL[c1]",
			"§/M[m1]");

	private static ClassDeclaration account()
	{
		ParseResult result = ParseResult.module(ACCOUNT);
		assertTrue(result.diagnostics.isEmpty(), () -> result.diagnostics.getDiagnostics().toString());
		assertEquals(1, result.module.getClasses().size());
		return result.module.getClasses().get(0);
	}

	@Test
	void classHeader()
	{
		ClassDeclaration account = account();

		assertEquals("c1", account.getId());
		assertEquals("Account", account.getName());
		assertEquals("Entity", account.getBaseClass());
		assertEquals(Set.of(Modifier.SEALED), account.getModifiers());
		assertEquals(List.of("IAccount"), account.getInterfaces());
		assertTrue(account.getTypeParameters().isEmpty());
	}

	@Test
	void fieldWithDefault()
	{
		FieldDeclaration balance = account().getFields().get(0);

		assertEquals("balance", balance.getName());
		assertEquals("INT", balance.getType());
		assertEquals(Visibility.PRIVATE, balance.getVisibility());
		assertEquals(0L, assertInstanceOf(IntLiteral.class, balance.getDefaultValue()).getValue());
	}

	@Test
	void propertyAccessors()
	{
		PropertyDeclaration property = account().getProperties().get(0);

		assertEquals("p1", property.getId());
		assertEquals("Balance", property.getName());
		assertEquals("INT", property.getType());
		assertEquals(Visibility.PUBLIC, property.getVisibility());

		AccessorDeclaration getter = property.getGetter();
		assertEquals(AccessorKind.GET, getter.getKind());
		assertNull(getter.getVisibility());
		assertInstanceOf(ReturnStatement.class, getter.getBody().get(0));

		AccessorDeclaration setter = property.getSetter();
		assertEquals(Visibility.PRIVATE, setter.getVisibility());
		assertInstanceOf(AssignmentStatement.class, setter.getBody().get(0));
		assertNull(property.getInitAccessor());
	}

	@Test
	void constructorWithBaseInitializer()
	{
		ConstructorDeclaration constructor = account().getConstructors().get(0);

		assertEquals("k1", constructor.getId());
		assertEquals(Visibility.PUBLIC, constructor.getVisibility());
		assertEquals("start", constructor.getParameters().get(0).getName());

		ConstructorInitializer initializer = constructor.getInitializer();
		assertTrue(initializer.isBase());
		assertEquals("acct", assertInstanceOf(StringLiteral.class, initializer.getArguments().get(0)).getValue());
		assertEquals(1, constructor.getBody().size());
	}

	@Test
	void methodHeaderAndBody()
	{
		MethodDeclaration deposit = account().getMethods().get(0);

		assertEquals("mt1", deposit.getId());
		assertEquals("Deposit", deposit.getName());
		assertEquals(Visibility.PUBLIC, deposit.getVisibility());
		assertEquals(Set.of(Modifier.VIRTUAL), deposit.getModifiers());
		assertEquals("amount", deposit.getHeader().getParameters().get(0).getName());
		assertEquals("VOID", deposit.getHeader().getOutput().getType());

		AssignmentStatement assignment = assertInstanceOf(AssignmentStatement.class, deposit.getBody().get(0));
		assertInstanceOf(BinaryOperation.class, assignment.getValue());
	}

	@Test
	void typeParametersOnTheClassName()
	{
		ParseResult result = ParseResult.module("§M[m1:Boxes] §CL[c2:Pair<K,V>] §FLD[K:key] §/CL[c2] §/M[m1]");

		assertTrue(result.diagnostics.isEmpty());
		ClassDeclaration pair = result.module.getClasses().get(0);
		assertEquals("Pair", pair.getName());
		assertEquals(2, pair.getTypeParameters().size());
		assertEquals("V", pair.getTypeParameters().get(1).getName());
		assertNull(pair.getBaseClass());
	}

	@Test
	void typeParametersAfterTheTag()
	{
		ParseResult result = ParseResult.module("§M[m1:Boxes] §CL[c3:Box]<T> §/CL[c3] §/M[m1]");

		assertTrue(result.diagnostics.isEmpty());
		ClassDeclaration box = result.module.getClasses().get(0);
		assertEquals("Box", box.getName());
		assertEquals("T", box.getTypeParameters().get(0).getName());
	}

	@Test
	void extendsTagOverridesTheBaseSlot()
	{
		ParseResult result = ParseResult.module("§M[m1:Shapes] §CL[c1:Circle:abs] §EXT[Shape] §/CL[c1] §/M[m1]");

		ClassDeclaration circle = result.module.getClasses().get(0);
		assertEquals("Shape", circle.getBaseClass());
		assertEquals(Set.of(Modifier.ABSTRACT), circle.getModifiers());
	}

	@Test
	void interfaceWithMethodSignatures()
	{
		ParseResult result = ParseResult.module(
				"§M[m1:Bank] §IFACE[i1:IAccount] §EXT[IEntity] §MT[mt1:Deposit] §I[i32:amount] §/MT[mt1] §/IFACE[i1] §/M[m1]");

		assertTrue(result.diagnostics.isEmpty());
		InterfaceDeclaration contract = result.module.getInterfaces().get(0);
		assertEquals("i1", contract.getId());
		assertEquals("IAccount", contract.getName());
		assertEquals(List.of("IEntity"), contract.getBaseInterfaces());

		MethodSignature deposit = contract.getMethods().get(0);
		assertEquals("Deposit", deposit.getName());
		assertEquals(1, deposit.getHeader().getParameters().size());
	}

	@Test
	void missingConstructorCloseStopsAtTheClassClose()
	{
		ParseResult result = ParseResult.module(
				"§M[m1:Bank] §CL[c1:Account] §CTOR[k1] §ASSIGN balance 0 §/CL[c1] §/M[m1]");

		assertEquals(1, result.diagnostics.size());
		assertEquals(1, result.diagnostics.count(DiagnosticCode.UNEXPECTED_TOKEN));
		ClassDeclaration account = result.module.getClasses().get(0);
		assertEquals(1, account.getConstructors().get(0).getBody().size());
	}
}
