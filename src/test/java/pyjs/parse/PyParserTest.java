package pyjs.parse;

import org.junit.jupiter.api.Test;
import pyjs.ast.BinaryOperator;
import pyjs.ast.PyAssignStmt;
import pyjs.ast.PyAttributeExpr;
import pyjs.ast.PyBinaryExpr;
import pyjs.ast.PyCallExpr;
import pyjs.ast.PyClassDecl;
import pyjs.ast.PyDictExpr;
import pyjs.ast.PyExprStmt;
import pyjs.ast.PyForStmt;
import pyjs.ast.PyFunctionDecl;
import pyjs.ast.PyIfStmt;
import pyjs.ast.PyIntExpr;
import pyjs.ast.PyMemberAssignStmt;
import pyjs.ast.PyNameExpr;
import pyjs.ast.PyProgram;
import pyjs.ast.PyReturnStmt;
import pyjs.ast.PyStringExpr;
import pyjs.ast.PySubscriptExpr;
import pyjs.ast.PyUnaryExpr;
import pyjs.ast.UnaryOperator;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PyParserTest {
	@Test
	void parsesFunctionWithReturn() {
		PyProgram program = new PyParser().parse("def greet(name):\n" +
				"    return \"Hello, \" + name\n");

		PyFunctionDecl fn = assertInstanceOf(PyFunctionDecl.class, program.statements().get(0));
		assertEquals("greet", fn.name());
		assertEquals(List.of("name"), fn.parameters());
		PyReturnStmt ret = assertInstanceOf(PyReturnStmt.class, fn.body().get(0));
		PyBinaryExpr concat = assertInstanceOf(PyBinaryExpr.class, ret.value());
		assertEquals(BinaryOperator.ADD, concat.op());
		assertEquals("Hello, ", assertInstanceOf(PyStringExpr.class, concat.left()).value());
	}

	@Test
	void multiplicationBindsTighterThanAddition() {
		PyBinaryExpr add = valueOf("x = 1 + 2 * 3\n");

		assertEquals(BinaryOperator.ADD, add.op());
		assertEquals(BinaryOperator.MUL, assertInstanceOf(PyBinaryExpr.class, add.right()).op());
	}

	@Test
	void subtractionIsLeftAssociative() {
		PyBinaryExpr outer = valueOf("x = 1 - 2 - 3\n");

		assertEquals(BinaryOperator.SUB, outer.op());
		assertInstanceOf(PyBinaryExpr.class, outer.left());
		assertInstanceOf(PyIntExpr.class, outer.right());
	}

	@Test
	void powerIsRightAssociative() {
		PyBinaryExpr outer = valueOf("x = 2 ** 3 ** 2\n");

		assertEquals(BinaryOperator.POW, outer.op());
		assertInstanceOf(PyIntExpr.class, outer.left());
		assertEquals(BinaryOperator.POW, assertInstanceOf(PyBinaryExpr.class, outer.right()).op());
	}

	@Test
	void unaryMinusBindsLooserThanPower() {
		PyAssignStmt assign = assertInstanceOf(PyAssignStmt.class,
				new PyParser().parse("x = -y ** 2\n").statements().get(0));

		PyUnaryExpr neg = assertInstanceOf(PyUnaryExpr.class, assign.value());
		assertEquals(UnaryOperator.NEG, neg.op());
		assertEquals(BinaryOperator.POW, assertInstanceOf(PyBinaryExpr.class, neg.operand()).op());
	}

	@Test
	void notBindsLikeUnaryMinus() {
		PyBinaryExpr and = valueOf("x = not a == b and c\n");

		assertEquals(BinaryOperator.AND, and.op());
		PyBinaryExpr eq = assertInstanceOf(PyBinaryExpr.class, and.left());
		assertEquals(BinaryOperator.EQ, eq.op());
		assertEquals(UnaryOperator.NOT, assertInstanceOf(PyUnaryExpr.class, eq.left()).op());
	}

	@Test
	void parenthesesOverrideNot() {
		PyAssignStmt assign = assertInstanceOf(PyAssignStmt.class,
				new PyParser().parse("x = not (a == b)\n").statements().get(0));

		PyUnaryExpr not = assertInstanceOf(PyUnaryExpr.class, assign.value());
		assertEquals(BinaryOperator.EQ, assertInstanceOf(PyBinaryExpr.class, not.operand()).op());
	}

	@Test
	void orIsLoosest() {
		PyBinaryExpr or = valueOf("x = a and b or c\n");

		assertEquals(BinaryOperator.OR, or.op());
		assertEquals(BinaryOperator.AND, assertInstanceOf(PyBinaryExpr.class, or.left()).op());
	}

	@Test
	void rejectsChainedComparisons() {
		ParseException e = assertThrows(ParseException.class, () -> new PyParser().parse("ok = a < b < c\n"));
		assertEquals("chained comparisons are not supported", e.getMessage());
		assertEquals(1, e.getLine());
		assertEquals(12, e.getColumn());
	}

	@Test
	void elifBecomesNestedIf() {
		PyProgram program = new PyParser().parse("if a:\n" +
				"    x = 1\n" +
				"elif b:\n" +
				"    x = 2\n" +
				"else:\n" +
				"    x = 3\n");

		PyIfStmt outer = assertInstanceOf(PyIfStmt.class, program.statements().get(0));
		assertEquals(1, outer.elseBody().size());
		PyIfStmt inner = assertInstanceOf(PyIfStmt.class, outer.elseBody().get(0));
		assertEquals("b", assertInstanceOf(PyNameExpr.class, inner.condition()).name());
		assertTrue(inner.hasElse());
	}

	@Test
	void acceptsSimpleStatementOnHeaderLine() {
		PyIfStmt stmt = assertInstanceOf(PyIfStmt.class, new PyParser().parse("if x: y = 1\n").statements().get(0));

		assertEquals(1, stmt.thenBody().size());
		assertFalse(stmt.hasElse());
	}

	@Test
	void desugarsAugmentedAssignmentWithoutSharingNodes() {
		PyAssignStmt assign = assertInstanceOf(PyAssignStmt.class,
				new PyParser().parse("total += 1\n").statements().get(0));
		assertEquals("total", assign.target());
		PyBinaryExpr sum = assertInstanceOf(PyBinaryExpr.class, assign.value());
		assertEquals(BinaryOperator.ADD, sum.op());
		assertEquals("total", assertInstanceOf(PyNameExpr.class, sum.left()).name());

		PyMemberAssignStmt member = assertInstanceOf(PyMemberAssignStmt.class,
				new PyParser().parse("self.count *= 2\n").statements().get(0));
		PyBinaryExpr product = assertInstanceOf(PyBinaryExpr.class, member.value());
		assertEquals(BinaryOperator.MUL, product.op());
		assertEquals(member.target(), product.left());
		assertNotSame(member.target(), product.left());
	}

	@Test
	void parsesMemberAndSubscriptTargets() {
		PyProgram program = new PyParser().parse("self.n = 1\nd[\"k\"] = 2\n");

		PyMemberAssignStmt attr = assertInstanceOf(PyMemberAssignStmt.class, program.statements().get(0));
		assertInstanceOf(PyAttributeExpr.class, attr.target());
		PyMemberAssignStmt item = assertInstanceOf(PyMemberAssignStmt.class, program.statements().get(1));
		assertInstanceOf(PySubscriptExpr.class, item.target());
	}

	@Test
	void rejectsInvalidAssignmentTarget() {
		ParseException e = assertThrows(ParseException.class, () -> new PyParser().parse("f() = 1\n"));
		assertEquals("cannot assign to this expression", e.getMessage());
	}

	@Test
	void parsesClassWithMethods() {
		PyProgram program = new PyParser().parse("class Counter:\n" +
				"    \"\"\n" +
				"    def __init__(self, start):\n" +
				"        self.n = start\n" +
				"\n" +
				"    def bump(self):\n" +
				"        self.n += 1\n");

		PyClassDecl cls = assertInstanceOf(PyClassDecl.class, program.statements().get(0));
		assertEquals("Counter", cls.name());
		assertEquals(2, cls.methods().size());
		assertEquals(List.of("self", "start"), cls.methods().get(0).parameters());
	}

	@Test
	void rejectsBaseClasses() {
		ParseException e = assertThrows(ParseException.class,
				() -> new PyParser().parse("class A(B):\n    pass\n"));
		assertEquals("base classes are not supported", e.getMessage());
	}

	@Test
	void parsesForOverCall() {
		PyForStmt loop = assertInstanceOf(PyForStmt.class,
				new PyParser().parse("for i in range(3):\n    print(i)\n").statements().get(0));

		assertEquals("i", loop.loopVar());
		PyCallExpr range = assertInstanceOf(PyCallExpr.class, loop.iterable());
		assertEquals("range", assertInstanceOf(PyNameExpr.class, range.callee()).name());
		assertInstanceOf(PyExprStmt.class, loop.body().get(0));
	}

	@Test
	void parsesListAndDictLiterals() {
		PyAssignStmt dict = assertInstanceOf(PyAssignStmt.class,
				new PyParser().parse("d = {\"a\": [1, 2,], \"b\": {}}\n").statements().get(0));

		PyDictExpr literal = assertInstanceOf(PyDictExpr.class, dict.value());
		assertEquals(2, literal.entries().size());
	}

	@Test
	void concatenatesAdjacentStrings() {
		PyAssignStmt assign = assertInstanceOf(PyAssignStmt.class,
				new PyParser().parse("s = 'ab' \"cd\"\n").statements().get(0));

		assertEquals("abcd", assertInstanceOf(PyStringExpr.class, assign.value()).value());
	}

	@Test
	void reportsExpectedAndFoundTokens() {
		ParseException e = assertThrows(ParseException.class, () -> new PyParser().parse("def f(:\n    pass\n"));

		assertEquals(List.of("parameter name"), e.getExpectedOneOf());
		assertEquals("':'", e.getFound());
		assertEquals("expected parameter name but found ':'", e.getMessage());
	}

	@Test
	void reportsMissingIndentedBlock() {
		ParseException e = assertThrows(ParseException.class, () -> new PyParser().parse("if x:\ny = 1\n"));

		assertEquals("expected indented block but found 'y'", e.getMessage());
		assertEquals(2, e.getLine());
	}

	@Test
	void rejectsUnsupportedSyntaxWithClearMessages() {
		assertUnsupported("import os\n", "import statements are not supported");
		assertUnsupported("f(x=1)\n", "keyword arguments are not supported");
		assertUnsupported("y = xs[1:2]\n", "slices are not supported");
		assertUnsupported("t = (1, 2)\n", "tuples are not supported");
		assertUnsupported("s = {1, 2}\n", "set literals are not supported");
		assertUnsupported("ys = [x for x in xs]\n", "list comprehensions are not supported");
		assertUnsupported("def f(a, a):\n    pass\n", "duplicate parameter 'a'");
		assertUnsupported("def f(a=1):\n    pass\n", "default arguments are not supported");
		assertUnsupported("ok = a in xs\n", "the 'in' operator is not supported");
		assertUnsupported("for k, v in d:\n    pass\n", "tuple unpacking is not supported");
	}

	@Test
	void rejectsAugmentedTargetsContainingCalls() {
		assertUnsupported("xs[f()] += 1\n", "augmented assignment to a target containing a call is not supported");
		assertUnsupported("make().count -= 1\n", "augmented assignment to a target containing a call is not supported");
		assertInstanceOf(PyMemberAssignStmt.class, new PyParser().parse("xs[i + 1] += 1\n").statements().get(0));
	}

	private static void assertUnsupported(String source, String message) {
		ParseException e = assertThrows(ParseException.class, () -> new PyParser().parse(source), source);
		assertEquals(message, e.getMessage());
	}

	private static PyBinaryExpr valueOf(String source) {
		PyAssignStmt assign = assertInstanceOf(PyAssignStmt.class, new PyParser().parse(source).statements().get(0));
		return assertInstanceOf(PyBinaryExpr.class, assign.value());
	}
}
