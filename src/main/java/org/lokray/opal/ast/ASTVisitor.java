package org.lokray.opal.ast;

import org.lokray.opal.ast.declarations.*;
import org.lokray.opal.ast.statements.*;
import org.lokray.opal.ast.expressions.*;
import org.lokray.opal.ast.patterns.*;

/**
 * Visitor over every node kind of the syntax tree.
 * Adding a node kind adds a method here, so every visitor must handle it before it compiles.
 *
 * @param <R> The return type of the visit methods.
 */
public interface ASTVisitor<R>
{
	// --- Declarations ---
	R visitModuleDeclaration(ModuleDeclaration declaration);

	R visitUsingDirective(UsingDirective declaration);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitParameter(Parameter declaration);

	R visitTypeParameter(TypeParameter declaration);

	R visitTypeConstraint(TypeConstraint declaration);

	R visitOutputDeclaration(OutputDeclaration declaration);

	R visitEffectsDeclaration(EffectsDeclaration declaration);

	R visitRequiresClause(RequiresClause declaration);

	R visitEnsuresClause(EnsuresClause declaration);

	R visitClassDeclaration(ClassDeclaration declaration);

	R visitInterfaceDeclaration(InterfaceDeclaration declaration);

	R visitMethodSignature(MethodSignature declaration);

	R visitMethodDeclaration(MethodDeclaration declaration);

	R visitFieldDeclaration(FieldDeclaration declaration);

	R visitPropertyDeclaration(PropertyDeclaration declaration);

	R visitAccessorDeclaration(AccessorDeclaration declaration);

	R visitConstructorDeclaration(ConstructorDeclaration declaration);

	R visitConstructorInitializer(ConstructorInitializer declaration);

	R visitInvariantDeclaration(InvariantDeclaration declaration);

	R visitIssueDeclaration(IssueDeclaration declaration);

	R visitAssumptionDeclaration(AssumptionDeclaration declaration);

	R visitDecisionDeclaration(DecisionDeclaration declaration);

	R visitRejectedOption(RejectedOption declaration);

	R visitContextDeclaration(ContextDeclaration declaration);

	R visitFileReference(FileReference declaration);

	R visitLockDeclaration(LockDeclaration declaration);

	R visitAuthorDeclaration(AuthorDeclaration declaration);

	R visitRecordDefinition(RecordDefinition declaration);

	R visitFieldDefinition(FieldDefinition declaration);

	R visitUnionDefinition(UnionDefinition declaration);

	R visitVariantDefinition(VariantDefinition declaration);

	R visitEnumDefinition(EnumDefinition declaration);

	R visitEnumMember(EnumMember declaration);

	R visitEnumExtension(EnumExtension declaration);

	R visitDelegateDefinition(DelegateDefinition declaration);

	R visitEventDefinition(EventDefinition declaration);

	R visitExampleDeclaration(ExampleDeclaration declaration);

	R visitUsesDeclaration(UsesDeclaration declaration);

	R visitDependency(Dependency declaration);

	R visitSinceDeclaration(SinceDeclaration declaration);

	R visitDeprecatedDeclaration(DeprecatedDeclaration declaration);

	// --- Statements ---
	R visitCallStatement(CallStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitForStatement(ForStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitDoWhileStatement(DoWhileStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitElseIfClause(ElseIfClause statement);

	R visitBindStatement(BindStatement statement);

	R visitMatchStatement(MatchStatement statement);

	R visitMatchCase(MatchCase statement);

	R visitForeachStatement(ForeachStatement statement);

	R visitAssignmentStatement(AssignmentStatement statement);

	R visitTryStatement(TryStatement statement);

	R visitCatchClause(CatchClause statement);

	R visitThrowStatement(ThrowStatement statement);

	R visitRethrowStatement(RethrowStatement statement);

	R visitEventSubscriptionStatement(EventSubscriptionStatement statement);

	R visitBreakStatement(BreakStatement statement);

	R visitContinueStatement(ContinueStatement statement);

	R visitPrintStatement(PrintStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitCollectionPush(CollectionPush statement);

	R visitDictionaryPut(DictionaryPut statement);

	R visitCollectionRemove(CollectionRemove statement);

	R visitCollectionSetIndex(CollectionSetIndex statement);

	R visitCollectionInsert(CollectionInsert statement);

	R visitCollectionClear(CollectionClear statement);

	R visitYieldStatement(YieldStatement statement);

	R visitYieldBreakStatement(YieldBreakStatement statement);

	// --- Expressions ---
	R visitIntLiteral(IntLiteral expression);

	R visitFloatLiteral(FloatLiteral expression);

	R visitStringLiteral(StringLiteral expression);

	R visitBoolLiteral(BoolLiteral expression);

	R visitReferenceExpression(ReferenceExpression expression);

	R visitBinaryOperation(BinaryOperation expression);

	R visitUnaryOperation(UnaryOperation expression);

	R visitConditionalExpression(ConditionalExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitSomeExpression(SomeExpression expression);

	R visitNoneExpression(NoneExpression expression);

	R visitOkExpression(OkExpression expression);

	R visitErrExpression(ErrExpression expression);

	R visitRecordCreation(RecordCreation expression);

	R visitFieldAssignment(FieldAssignment expression);

	R visitMatchExpression(MatchExpression expression);

	R visitArrayCreation(ArrayCreation expression);

	R visitArrayAccess(ArrayAccess expression);

	R visitArrayLength(ArrayLength expression);

	R visitGenericInstantiation(GenericInstantiation expression);

	R visitNewExpression(NewExpression expression);

	R visitPropertyAssignment(PropertyAssignment expression);

	R visitThisExpression(ThisExpression expression);

	R visitBaseExpression(BaseExpression expression);

	R visitFieldAccess(FieldAccess expression);

	R visitNullConditional(NullConditional expression);

	R visitNullCoalesce(NullCoalesce expression);

	R visitLambdaExpression(LambdaExpression expression);

	R visitLambdaParameter(LambdaParameter expression);

	R visitAwaitExpression(AwaitExpression expression);

	R visitInterpolatedString(InterpolatedString expression);

	R visitInterpolationPart(InterpolationPart expression);

	R visitRangeExpression(RangeExpression expression);

	R visitIndexFromEnd(IndexFromEnd expression);

	R visitWithExpression(WithExpression expression);

	R visitMissingExpression(MissingExpression expression);

	R visitListCreation(ListCreation expression);

	R visitSetCreation(SetCreation expression);

	R visitDictionaryCreation(DictionaryCreation expression);

	R visitKeyValuePair(KeyValuePair expression);

	R visitCollectionContains(CollectionContains expression);

	R visitCollectionCount(CollectionCount expression);

	// --- Patterns ---
	R visitWildcardPattern(WildcardPattern pattern);

	R visitVariablePattern(VariablePattern pattern);

	R visitVarPattern(VarPattern pattern);

	R visitLiteralPattern(LiteralPattern pattern);

	R visitSomePattern(SomePattern pattern);

	R visitNonePattern(NonePattern pattern);

	R visitOkPattern(OkPattern pattern);

	R visitErrPattern(ErrPattern pattern);

	R visitPositionalPattern(PositionalPattern pattern);

	R visitPropertyPattern(PropertyPattern pattern);

	R visitPropertyMatch(PropertyMatch pattern);

	R visitRelationalPattern(RelationalPattern pattern);

	R visitListPattern(ListPattern pattern);
}
