package pyjs.parse;

import pyjs.ast.BinaryOperator;
import pyjs.ast.PyAssignStmt;
import pyjs.ast.PyAttributeExpr;
import pyjs.ast.PyBinaryExpr;
import pyjs.ast.PyBoolExpr;
import pyjs.ast.PyBreakStmt;
import pyjs.ast.PyCallExpr;
import pyjs.ast.PyClassDecl;
import pyjs.ast.PyContinueStmt;
import pyjs.ast.PyDictEntry;
import pyjs.ast.PyDictExpr;
import pyjs.ast.PyExpr;
import pyjs.ast.PyExprStmt;
import pyjs.ast.PyExprVisitor;
import pyjs.ast.PyFloatExpr;
import pyjs.ast.PyForStmt;
import pyjs.ast.PyFunctionDecl;
import pyjs.ast.PyIfStmt;
import pyjs.ast.PyIntExpr;
import pyjs.ast.PyListExpr;
import pyjs.ast.PyMemberAssignStmt;
import pyjs.ast.PyNameExpr;
import pyjs.ast.PyNoneExpr;
import pyjs.ast.PyPassStmt;
import pyjs.ast.PyProgram;
import pyjs.ast.PyReturnStmt;
import pyjs.ast.PyStmt;
import pyjs.ast.PyStringExpr;
import pyjs.ast.PySubscriptExpr;
import pyjs.ast.PyUnaryExpr;
import pyjs.ast.PyWhileStmt;
import pyjs.ast.SourcePosition;
import pyjs.ast.UnaryOperator;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for the supported Python subset.
 *
 * <pre>
 * program    : ( statement )* END_OF_INPUT ;
 * statement  : funcDef | classDef | ifStmt | forStmt | whileStmt | simple NEWLINE ;
 * simple     : "return" expr? | "pass" | "break" | "continue"
 *            | expr ( ( "=" | "+=" | "-=" | "*=" | "/=" ) expr )? ;
 * block      : ":" ( NEWLINE INDENT statement+ DEDENT | simple NEWLINE ) ;
 * funcDef    : "def" NAME "(" ( NAME ( "," NAME )* ","? )? ")" block ;
 * classDef   : "class" NAME ( "(" ")" )? ":" NEWLINE INDENT ( funcDef | "pass" NEWLINE )+ DEDENT ;
 * ifStmt     : "if" expr block ( "elif" expr block )* ( "else" block )? ;
 * forStmt    : "for" NAME "in" expr block ;
 * whileStmt  : "while" expr block ;
 * expr       : binary operators by precedence climbing, loosest to tightest:
 *              or, and, comparison, + -, * / // %, not and - (prefix), ** (right) ;
 * postfix    : primary ( "(" args? ")" | "[" expr "]" | "." NAME )* ;
 * primary    : INTEGER | FLOAT | STRING+ | "True" | "False" | "None" | NAME
 *            | "(" expr ")" | "[" ( expr ( "," expr )* ","? )? "]"
 *            | "{" ( expr ":" expr ( "," expr ":" expr )* ","? )? "}" ;
 * </pre>
 *
 * Stops at the first error; there is no resynchronization.
 */
public final class PyParser {
	private static final Map<String, String> UNSUPPORTED_KEYWORDS = Map.ofEntries(
			Map.entry("import", "import statements are not supported"),
			Map.entry("from", "import statements are not supported"),
			Map.entry("try", "exceptions are not supported"),
			Map.entry("except", "exceptions are not supported"),
			Map.entry("finally", "exceptions are not supported"),
			Map.entry("raise", "exceptions are not supported"),
			Map.entry("with", "'with' statements are not supported"),
			Map.entry("yield", "generators are not supported"),
			Map.entry("global", "'global' declarations are not supported"),
			Map.entry("nonlocal", "'nonlocal' declarations are not supported"),
			Map.entry("del", "'del' statements are not supported"),
			Map.entry("assert", "'assert' statements are not supported"),
			Map.entry("async", "async functions are not supported"),
			Map.entry("await", "async functions are not supported"),
			Map.entry("lambda", "lambda expressions are not supported"),
			Map.entry("is", "the 'is' operator is not supported"),
			Map.entry("in", "the 'in' operator is not supported"),
			Map.entry("as", "'as' is not supported"));

	private static final Map<String, BinaryOperator> AUGMENTED = Map.of(
			"+=", BinaryOperator.ADD,
			"-=", BinaryOperator.SUB,
			"*=", BinaryOperator.MUL,
			"/=", BinaryOperator.DIV);

	public PyProgram parse(String source) {
		return parse(new PyLexer().lex(source));
	}

	public PyProgram parse(List<PyToken> tokens) {
		Cursor c = new Cursor(tokens);
		List<PyStmt> statements = new ArrayList<>();
		while (!c.isAtEnd()) {
			if (c.peekIs(PyTokenKind.NEWLINE)) {
				c.next();
				continue;
			}
			if (c.peekIs(PyTokenKind.INDENT)) {
				throw new ParseException("unexpected indent", c.peek());
			}
			statements.add(parseStatement(c));
		}
		return new PyProgram(statements, new SourcePosition(1, 1));
	}

	private PyStmt parseStatement(Cursor c) {
		PyToken t = c.peek();
		if (t.kind() == PyTokenKind.KEYWORD) {
			switch (t.lexeme()) {
				case "def":
					return parseFunction(c);
				case "class":
					return parseClass(c);
				case "if":
					return parseIfRest(c.next(), c);
				case "for":
					return parseFor(c);
				case "while":
					return parseWhile(c);
				case "elif":
				case "else":
					throw new ParseException("'" + t.lexeme() + "' without a matching 'if'", t);
				default:
					break;
			}
		}
		return parseSimpleStatement(c);
	}

	private PyStmt parseSimpleStatement(Cursor c) {
		PyStmt stmt = parseSimple(c);
		c.expect(PyTokenKind.NEWLINE, "end of line");
		return stmt;
	}

	private PyStmt parseSimple(Cursor c) {
		PyToken start = c.peek();
		if (start.kind() == PyTokenKind.KEYWORD) {
			switch (start.lexeme()) {
				case "return": {
					c.next();
					PyExpr value = c.peekIs(PyTokenKind.NEWLINE) ? null : parseExpression(c);
					return new PyReturnStmt(value, positionOf(start));
				}
				case "pass":
					c.next();
					return new PyPassStmt(positionOf(start));
				case "break":
					c.next();
					return new PyBreakStmt(positionOf(start));
				case "continue":
					c.next();
					return new PyContinueStmt(positionOf(start));
				default:
					if (UNSUPPORTED_KEYWORDS.containsKey(start.lexeme())) {
						throw new ParseException(UNSUPPORTED_KEYWORDS.get(start.lexeme()), start);
					}
			}
		}

		PyExpr expr = parseExpression(c);
		PyToken op = c.peek();
		if (op.is(PyTokenKind.OPERATOR, "=") || (op.kind() == PyTokenKind.OPERATOR && AUGMENTED.containsKey(op.lexeme()))) {
			c.next();
			PyExpr value = parseExpression(c);
			if (c.peek().is(PyTokenKind.OPERATOR, "=")) {
				throw new ParseException("chained assignment is not supported", c.peek());
			}
			BinaryOperator augmented = AUGMENTED.get(op.lexeme());
			if (augmented != null) {
				// the target is printed twice, so a call inside it would run twice
				if (containsCall(expr)) {
					throw new ParseException("augmented assignment to a target containing a call is not supported", op);
				}
				value = new PyBinaryExpr(augmented, expr.accept(new Copier()), value, positionOf(op));
			}
			return assignment(expr, value, start);
		}
		return new PyExprStmt(expr, positionOf(start));
	}

	private static boolean containsCall(PyExpr expr) {
		if (expr instanceof PyCallExpr) {
			return true;
		}
		if (expr instanceof PyAttributeExpr attribute) {
			return containsCall(attribute.object());
		}
		if (expr instanceof PySubscriptExpr subscript) {
			return containsCall(subscript.object()) || containsCall(subscript.index());
		}
		if (expr instanceof PyBinaryExpr binary) {
			return containsCall(binary.left()) || containsCall(binary.right());
		}
		if (expr instanceof PyUnaryExpr unary) {
			return containsCall(unary.operand());
		}
		if (expr instanceof PyListExpr list) {
			return list.elements().stream().anyMatch(PyParser::containsCall);
		}
		if (expr instanceof PyDictExpr dict) {
			return dict.entries().stream().anyMatch(e -> containsCall(e.key()) || containsCall(e.value()));
		}
		return false;
	}

	private PyStmt assignment(PyExpr target, PyExpr value, PyToken start) {
		if (target instanceof PyNameExpr name) {
			return new PyAssignStmt(name.name(), value, name.position());
		}
		if (target instanceof PyAttributeExpr || target instanceof PySubscriptExpr) {
			return new PyMemberAssignStmt(target, value, positionOf(start));
		}
		throw new ParseException("cannot assign to this expression", start);
	}

	private PyFunctionDecl parseFunction(Cursor c) {
		PyToken start = c.expectKeyword("def");
		PyToken name = c.expect(PyTokenKind.IDENTIFIER, "function name");
		c.expectDelimiter("(");

		List<String> params = new ArrayList<>();
		while (!c.peekIsDelimiter(")")) {
			PyToken param = c.expect(PyTokenKind.IDENTIFIER, "parameter name");
			if (params.contains(param.lexeme())) {
				throw new ParseException("duplicate parameter '" + param.lexeme() + "'", param);
			}
			params.add(param.lexeme());
			if (c.peek().is(PyTokenKind.OPERATOR, "=")) {
				throw new ParseException("default arguments are not supported", c.peek());
			}
			if (!c.peekIsDelimiter(",")) {
				break;
			}
			c.next();
		}
		c.expectOneOf(List.of("','", "')'"), ")");

		List<PyStmt> body = parseBlock(c);
		return new PyFunctionDecl(name.lexeme(), params, body, positionOf(start));
	}

	private PyClassDecl parseClass(Cursor c) {
		PyToken start = c.expectKeyword("class");
		PyToken name = c.expect(PyTokenKind.IDENTIFIER, "class name");
		if (c.peekIsDelimiter("(")) {
			c.next();
			if (!c.peekIsDelimiter(")")) {
				throw new ParseException("base classes are not supported", c.peek());
			}
			c.next();
		}
		c.expectDelimiter(":");

		List<PyFunctionDecl> methods = new ArrayList<>();
		if (!c.peekIs(PyTokenKind.NEWLINE)) {
			c.expectKeyword("pass");
			c.expect(PyTokenKind.NEWLINE, "end of line");
			return new PyClassDecl(name.lexeme(), methods, positionOf(start));
		}
		c.next();
		c.expect(PyTokenKind.INDENT, "indented block");
		while (!c.peekIs(PyTokenKind.DEDENT) && !c.isAtEnd()) {
			PyToken t = c.peek();
			if (t.is(PyTokenKind.KEYWORD, "def")) {
				methods.add(parseFunction(c));
			} else if (t.is(PyTokenKind.KEYWORD, "pass") || t.kind() == PyTokenKind.STRING) {
				// docstrings and 'pass' carry nothing into the class
				parseSimpleStatement(c);
			} else {
				throw new ParseException("only method definitions are supported in a class body", t);
			}
		}
		c.expect(PyTokenKind.DEDENT, "dedent");
		return new PyClassDecl(name.lexeme(), methods, positionOf(start));
	}

	private PyIfStmt parseIfRest(PyToken start, Cursor c) {
		PyExpr condition = parseExpression(c);
		List<PyStmt> thenBody = parseBlock(c);
		List<PyStmt> elseBody = List.of();
		if (c.peek().is(PyTokenKind.KEYWORD, "elif")) {
			elseBody = List.of(parseIfRest(c.next(), c));
		} else if (c.peek().is(PyTokenKind.KEYWORD, "else")) {
			c.next();
			elseBody = parseBlock(c);
		}
		return new PyIfStmt(condition, thenBody, elseBody, positionOf(start));
	}

	private PyForStmt parseFor(Cursor c) {
		PyToken start = c.expectKeyword("for");
		PyToken loopVar = c.expect(PyTokenKind.IDENTIFIER, "loop variable");
		if (c.peekIsDelimiter(",")) {
			throw new ParseException("tuple unpacking is not supported", c.peek());
		}
		c.expectKeyword("in");
		PyExpr iterable = parseExpression(c);
		List<PyStmt> body = parseBlock(c);
		return new PyForStmt(loopVar.lexeme(), iterable, body, positionOf(start));
	}

	private PyWhileStmt parseWhile(Cursor c) {
		PyToken start = c.expectKeyword("while");
		PyExpr condition = parseExpression(c);
		List<PyStmt> body = parseBlock(c);
		return new PyWhileStmt(condition, body, positionOf(start));
	}

	private List<PyStmt> parseBlock(Cursor c) {
		c.expectDelimiter(":");
		if (!c.peekIs(PyTokenKind.NEWLINE)) {
			return List.of(parseSimpleStatement(c));
		}
		c.next();
		c.expect(PyTokenKind.INDENT, "indented block");
		List<PyStmt> stmts = new ArrayList<>();
		while (!c.peekIs(PyTokenKind.DEDENT) && !c.isAtEnd()) {
			stmts.add(parseStatement(c));
		}
		c.expect(PyTokenKind.DEDENT, "dedent");
		return stmts;
	}

	private PyExpr parseExpression(Cursor c) {
		return parseBinary(c, 1);
	}

	/**
	 * Precedence climbing: folds every binary operator binding at least as tight as {@code minPrecedence}.
	 */
	private PyExpr parseBinary(Cursor c, int minPrecedence) {
		PyExpr left = parsePrefix(c);
		while (true) {
			PyToken t = c.peek();
			BinaryOperator op = binaryOperatorAt(t);
			if (op == null || op.precedence() < minPrecedence) {
				return left;
			}
			c.next();
			int nextMin = op.isRightAssociative() ? BinaryOperator.UNARY_PRECEDENCE : op.precedence() + 1;
			PyExpr right = parseBinary(c, nextMin);
			left = new PyBinaryExpr(op, left, right, positionOf(t));

			if (op.isComparison()) {
				BinaryOperator following = binaryOperatorAt(c.peek());
				if (following != null && following.isComparison()) {
					throw new ParseException("chained comparisons are not supported", c.peek());
				}
			}
		}
	}

	private PyExpr parsePrefix(Cursor c) {
		PyToken t = c.peek();
		UnaryOperator op = null;
		if (t.is(PyTokenKind.KEYWORD, "not")) {
			op = UnaryOperator.NOT;
		} else if (t.is(PyTokenKind.OPERATOR, "-")) {
			op = UnaryOperator.NEG;
		}
		if (op == null) {
			return parsePostfix(c);
		}
		c.next();
		// the operand may still hold '**', which binds tighter than any prefix operator
		PyExpr operand = parseBinary(c, BinaryOperator.UNARY_PRECEDENCE);
		return new PyUnaryExpr(op, operand, positionOf(t));
	}

	private PyExpr parsePostfix(Cursor c) {
		PyExpr expr = parsePrimary(c);
		while (true) {
			if (c.peekIsDelimiter("(")) {
				c.next();
				expr = new PyCallExpr(expr, parseArguments(c), expr.position());
			} else if (c.peekIsDelimiter("[")) {
				PyToken open = c.next();
				PyExpr index = parseExpression(c);
				if (c.peekIsDelimiter(":")) {
					throw new ParseException("slices are not supported", c.peek());
				}
				c.expectDelimiter("]");
				expr = new PySubscriptExpr(expr, index, positionOf(open));
			} else if (c.peekIsDelimiter(".")) {
				c.next();
				PyToken member = c.expect(PyTokenKind.IDENTIFIER, "attribute name");
				expr = new PyAttributeExpr(expr, member.lexeme(), positionOf(member));
			} else {
				return expr;
			}
		}
	}

	private List<PyExpr> parseArguments(Cursor c) {
		List<PyExpr> args = new ArrayList<>();
		while (!c.peekIsDelimiter(")")) {
			if (c.peekIs(PyTokenKind.IDENTIFIER) && c.peek(1).is(PyTokenKind.OPERATOR, "=")) {
				throw new ParseException("keyword arguments are not supported", c.peek());
			}
			args.add(parseExpression(c));
			if (!c.peekIsDelimiter(",")) {
				break;
			}
			c.next();
		}
		c.expectOneOf(List.of("','", "')'"), ")");
		return args;
	}

	private PyExpr parsePrimary(Cursor c) {
		PyToken t = c.peek();
		switch (t.kind()) {
			case INTEGER:
				c.next();
				return new PyIntExpr(new BigInteger(t.lexeme()), positionOf(t));
			case FLOAT:
				c.next();
				return new PyFloatExpr(Double.parseDouble(t.lexeme()), positionOf(t));
			case STRING: {
				StringBuilder value = new StringBuilder(c.next().lexeme());
				// adjacent literals concatenate
				while (c.peekIs(PyTokenKind.STRING)) {
					value.append(c.next().lexeme());
				}
				return new PyStringExpr(value.toString(), positionOf(t));
			}
			case IDENTIFIER:
				c.next();
				return new PyNameExpr(t.lexeme(), positionOf(t));
			case KEYWORD:
				switch (t.lexeme()) {
					case "True":
						c.next();
						return new PyBoolExpr(true, positionOf(t));
					case "False":
						c.next();
						return new PyBoolExpr(false, positionOf(t));
					case "None":
						c.next();
						return new PyNoneExpr(positionOf(t));
					default:
						if (UNSUPPORTED_KEYWORDS.containsKey(t.lexeme())) {
							throw new ParseException(UNSUPPORTED_KEYWORDS.get(t.lexeme()), t);
						}
						throw new ParseException(List.of("expression"), t);
				}
			case DELIMITER:
				if (t.lexeme().equals("(")) {
					return parseParenthesized(c);
				}
				if (t.lexeme().equals("[")) {
					return parseList(c);
				}
				if (t.lexeme().equals("{")) {
					return parseDict(c);
				}
				throw new ParseException(List.of("expression"), t);
			default:
				throw new ParseException(List.of("expression"), t);
		}
	}

	private PyExpr parseParenthesized(Cursor c) {
		c.expectDelimiter("(");
		if (c.peekIsDelimiter(")")) {
			throw new ParseException("tuples are not supported", c.peek());
		}
		PyExpr inner = parseExpression(c);
		if (c.peekIsDelimiter(",")) {
			throw new ParseException("tuples are not supported", c.peek());
		}
		c.expectDelimiter(")");
		return inner;
	}

	private PyListExpr parseList(Cursor c) {
		PyToken open = c.expectDelimiter("[");
		List<PyExpr> elements = new ArrayList<>();
		while (!c.peekIsDelimiter("]")) {
			elements.add(parseExpression(c));
			if (c.peek().is(PyTokenKind.KEYWORD, "for")) {
				throw new ParseException("list comprehensions are not supported", c.peek());
			}
			if (!c.peekIsDelimiter(",")) {
				break;
			}
			c.next();
		}
		c.expectOneOf(List.of("','", "']'"), "]");
		return new PyListExpr(elements, positionOf(open));
	}

	private PyDictExpr parseDict(Cursor c) {
		PyToken open = c.expectDelimiter("{");
		List<PyDictEntry> entries = new ArrayList<>();
		while (!c.peekIsDelimiter("}")) {
			PyExpr key = parseExpression(c);
			if (c.peekIsDelimiter(",") || c.peekIsDelimiter("}")) {
				throw new ParseException("set literals are not supported", c.peek());
			}
			c.expectDelimiter(":");
			PyExpr value = parseExpression(c);
			entries.add(new PyDictEntry(key, value));
			if (!c.peekIsDelimiter(",")) {
				break;
			}
			c.next();
		}
		c.expectOneOf(List.of("','", "'}'"), "}");
		return new PyDictExpr(entries, positionOf(open));
	}

	private static BinaryOperator binaryOperatorAt(PyToken t) {
		if (t.kind() == PyTokenKind.OPERATOR || t.is(PyTokenKind.KEYWORD, "and") || t.is(PyTokenKind.KEYWORD, "or")) {
			return BinaryOperator.fromSymbol(t.lexeme());
		}
		if (t.is(PyTokenKind.KEYWORD, "in") || t.is(PyTokenKind.KEYWORD, "is")) {
			throw new ParseException(UNSUPPORTED_KEYWORDS.get(t.lexeme()), t);
		}
		return null;
	}

	private static SourcePosition positionOf(PyToken t) {
		return new SourcePosition(t.line(), t.column());
	}

	/**
	 * Deep copy used when desugaring {@code x += y}: the target appears twice in the result and the tree must
	 * not share nodes.
	 */
	private static final class Copier implements PyExprVisitor<PyExpr> {
		@Override
		public PyExpr visitBinary(PyBinaryExpr e) {
			return new PyBinaryExpr(e.op(), e.left().accept(this), e.right().accept(this), e.position());
		}

		@Override
		public PyExpr visitUnary(PyUnaryExpr e) {
			return new PyUnaryExpr(e.op(), e.operand().accept(this), e.position());
		}

		@Override
		public PyExpr visitCall(PyCallExpr e) {
			return new PyCallExpr(e.callee().accept(this), copyAll(e.args()), e.position());
		}

		@Override
		public PyExpr visitName(PyNameExpr e) {
			return new PyNameExpr(e.name(), e.position());
		}

		@Override
		public PyExpr visitInt(PyIntExpr e) {
			return new PyIntExpr(e.value(), e.position());
		}

		@Override
		public PyExpr visitFloat(PyFloatExpr e) {
			return new PyFloatExpr(e.value(), e.position());
		}

		@Override
		public PyExpr visitString(PyStringExpr e) {
			return new PyStringExpr(e.value(), e.position());
		}

		@Override
		public PyExpr visitBool(PyBoolExpr e) {
			return new PyBoolExpr(e.value(), e.position());
		}

		@Override
		public PyExpr visitNone(PyNoneExpr e) {
			return new PyNoneExpr(e.position());
		}

		@Override
		public PyExpr visitList(PyListExpr e) {
			return new PyListExpr(copyAll(e.elements()), e.position());
		}

		@Override
		public PyExpr visitDict(PyDictExpr e) {
			List<PyDictEntry> entries = new ArrayList<>();
			for (PyDictEntry entry : e.entries()) {
				entries.add(new PyDictEntry(entry.key().accept(this), entry.value().accept(this)));
			}
			return new PyDictExpr(entries, e.position());
		}

		@Override
		public PyExpr visitAttribute(PyAttributeExpr e) {
			return new PyAttributeExpr(e.object().accept(this), e.member(), e.position());
		}

		@Override
		public PyExpr visitSubscript(PySubscriptExpr e) {
			return new PySubscriptExpr(e.object().accept(this), e.index().accept(this), e.position());
		}

		private List<PyExpr> copyAll(List<PyExpr> exprs) {
			List<PyExpr> out = new ArrayList<>();
			for (PyExpr e : exprs) {
				out.add(e.accept(this));
			}
			return out;
		}
	}

	private static final class Cursor {
		private final List<PyToken> tokens;
		private int pos;

		Cursor(List<PyToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().kind() == PyTokenKind.END_OF_INPUT;
		}

		PyToken peek() {
			return tokens.get(pos);
		}

		PyToken peek(int offset) {
			return tokens.get(Math.min(pos + offset, tokens.size() - 1));
		}

		PyToken next() {
			PyToken t = tokens.get(pos);
			if (pos < tokens.size() - 1) {
				pos++;
			}
			return t;
		}

		boolean peekIs(PyTokenKind kind) {
			return peek().kind() == kind;
		}

		boolean peekIsDelimiter(String lexeme) {
			return peek().is(PyTokenKind.DELIMITER, lexeme);
		}

		PyToken expectKeyword(String lexeme) {
			PyToken t = peek();
			if (!t.is(PyTokenKind.KEYWORD, lexeme)) {
				throw new ParseException(List.of("'" + lexeme + "'"), t);
			}
			return next();
		}

		PyToken expectDelimiter(String lexeme) {
			return expectOneOf(List.of("'" + lexeme + "'"), lexeme);
		}

		PyToken expectOneOf(List<String> expected, String lexeme) {
			PyToken t = peek();
			if (!t.is(PyTokenKind.DELIMITER, lexeme)) {
				throw new ParseException(expected, t);
			}
			return next();
		}

		PyToken expect(PyTokenKind kind, String what) {
			PyToken t = peek();
			if (t.kind() != kind) {
				throw new ParseException(List.of(what), t);
			}
			return next();
		}
	}
}
