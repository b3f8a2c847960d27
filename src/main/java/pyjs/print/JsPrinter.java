package pyjs.print;

import pyjs.analysis.BuiltinFunction;
import pyjs.analysis.InferredType;
import pyjs.analysis.SemanticModel;
import pyjs.analysis.SymbolInfo;
import pyjs.analysis.SymbolKind;
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
import pyjs.ast.PyStmtVisitor;
import pyjs.ast.PyStringExpr;
import pyjs.ast.PySubscriptExpr;
import pyjs.ast.PyUnaryExpr;
import pyjs.ast.PyWhileStmt;
import pyjs.ast.UnaryOperator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Prints an analyzed program as JavaScript.
 *
 * Notes:
 * - Every binary and unary operation is parenthesized, so operator precedence never has to be reconstructed.
 * - Python binds names per function while JavaScript binds per block: a name first assigned inside a nested
 *   block is declared once with {@code let} at the top of the enclosing function (or module) body.
 * - Built-in calls are rewritten only when the callee resolved to the built-in, never when a user
 *   declaration shadows it.
 */
public final class JsPrinter {
	static final Set<String> RESERVED_WORDS = Set.of(
			"arguments", "await", "case", "catch", "const", "debugger", "default", "delete", "do", "enum", "eval",
			"export", "extends", "false", "function", "implements", "import", "instanceof", "interface", "let",
			"new", "null", "package", "private", "protected", "public", "static", "super", "switch", "this",
			"throw", "true", "try", "typeof", "var", "void", "with", "yield", "undefined", "NaN", "Infinity",
			// globals the printed code calls into
			"console", "Math", "Array", "Object", "String", "Number", "Boolean");

	private static final Map<String, String> STRING_METHODS = Map.of(
			"upper", "toUpperCase",
			"lower", "toLowerCase",
			"strip", "trim");

	private static final Map<String, String> DICT_METHODS = Map.of(
			"keys", "Object.keys",
			"values", "Object.values",
			"items", "Object.entries");

	private final String indent;

	public JsPrinter() {
		this("  ");
	}

	public JsPrinter(String indent) {
		this.indent = indent;
	}

	public String print(PyProgram program, SemanticModel model) {
		Emit emit = new Emit(model, methodNames(program.statements()));
		emit.body(program.statements(), List.of(), true);
		return emit.out.toString();
	}

	static String jsName(String name) {
		return RESERVED_WORDS.contains(name) ? name + "_" : name;
	}

	private final class Emit implements PyStmtVisitor<Void>, PyExprVisitor<String> {
		private final StringBuilder out = new StringBuilder();
		private final SemanticModel model;
		private final Set<String> userMethods;
		private Set<String> declared = new HashSet<>();
		private Set<String> functionValues = Set.of();
		private String selfName;
		private int depth;

		Emit(SemanticModel model, Set<String> userMethods) {
			this.model = model;
			this.userMethods = userMethods;
		}

		/**
		 * Prints one function or module body. {@code parameters} are already bound and never redeclared.
		 */
		void body(List<PyStmt> stmts, List<String> parameters, boolean topLevel) {
			Set<String> saved = declared;
			Set<String> savedFunctionValues = functionValues;
			declared = new HashSet<>(parameters);
			functionValues = redefinedFunctions(stmts);

			Set<String> hoisted = new LinkedHashSet<>(functionValues);
			hoisted.addAll(hoistedNames(stmts, declared));
			if (!hoisted.isEmpty()) {
				line("let " + hoisted.stream().map(JsPrinter::jsName).collect(Collectors.joining(", ")) + ";");
				declared.addAll(hoisted);
			}

			for (int i = 0; i < stmts.size(); i++) {
				PyStmt stmt = stmts.get(i);
				stmt.accept(this);
				boolean declaration = stmt instanceof PyFunctionDecl || stmt instanceof PyClassDecl;
				if (topLevel && declaration && i < stmts.size() - 1) {
					out.append('\n');
				}
			}
			declared = saved;
			functionValues = savedFunctionValues;
		}

		private void block(List<PyStmt> stmts) {
			depth++;
			for (PyStmt stmt : stmts) {
				stmt.accept(this);
			}
			depth--;
		}

		private void line(String text) {
			out.append(indent.repeat(depth)).append(text).append('\n');
		}

		@Override
		public Void visitFunctionDecl(PyFunctionDecl stmt) {
			// a redefined function is a plain variable, since declarations would all hoist to the top
			boolean asValue = functionValues.contains(stmt.name());
			String params = "(" + joinNames(stmt.parameters()) + ") {";
			line(asValue ? jsName(stmt.name()) + " = function " + params : "function " + jsName(stmt.name()) + params);
			String savedSelf = selfName;
			selfName = null;
			depth++;
			body(stmt.body(), stmt.parameters(), false);
			depth--;
			selfName = savedSelf;
			line(asValue ? "};" : "}");
			return null;
		}

		@Override
		public Void visitClassDecl(PyClassDecl stmt) {
			line("class " + jsName(stmt.name()) + " {");
			depth++;
			for (int i = 0; i < stmt.methods().size(); i++) {
				if (i > 0) {
					out.append('\n');
				}
				method(stmt.methods().get(i));
			}
			depth--;
			line("}");
			return null;
		}

		private void method(PyFunctionDecl method) {
			List<String> params = method.parameters();
			List<String> visible = params.isEmpty() ? params : params.subList(1, params.size());
			// method names are property keys, where reserved words are legal
			String name = method.name().equals("__init__") ? "constructor" : method.name();
			line(name + "(" + joinNames(visible) + ") {");

			String savedSelf = selfName;
			selfName = params.isEmpty() ? null : params.get(0);
			depth++;
			body(method.body(), params, false);
			depth--;
			selfName = savedSelf;
			line("}");
		}

		@Override
		public Void visitIf(PyIfStmt stmt) {
			line("if " + condition(stmt.condition()) + " {");
			ifRest(stmt);
			return null;
		}

		private void ifRest(PyIfStmt stmt) {
			block(stmt.thenBody());
			if (!stmt.hasElse()) {
				line("}");
				return;
			}
			List<PyStmt> elseBody = stmt.elseBody();
			if (elseBody.size() == 1 && elseBody.get(0) instanceof PyIfStmt elif) {
				line("} else if " + condition(elif.condition()) + " {");
				ifRest(elif);
				return;
			}
			line("} else {");
			block(elseBody);
			line("}");
		}

		@Override
		public Void visitFor(PyForStmt stmt) {
			// loop variables are always hoisted, so the last value survives the loop
			line("for (" + jsName(stmt.loopVar()) + " of " + iterable(stmt.iterable()) + ") {");
			block(stmt.body());
			line("}");
			return null;
		}

		private String iterable(PyExpr iterable) {
			String printed = iterable.accept(this);
			if (model.typeOf(iterable) == InferredType.DICT) {
				return "Object.keys(" + printed + ")";
			}
			return printed;
		}

		@Override
		public Void visitWhile(PyWhileStmt stmt) {
			line("while " + condition(stmt.condition()) + " {");
			block(stmt.body());
			line("}");
			return null;
		}

		private String condition(PyExpr condition) {
			String printed = condition.accept(this);
			if (condition instanceof PyBinaryExpr bin && bin.op() != BinaryOperator.FLOOR_DIV
					|| condition instanceof PyUnaryExpr) {
				return printed;
			}
			return "(" + printed + ")";
		}

		@Override
		public Void visitReturn(PyReturnStmt stmt) {
			line(stmt.hasValue() ? "return " + stmt.value().accept(this) + ";" : "return;");
			return null;
		}

		@Override
		public Void visitAssign(PyAssignStmt stmt) {
			String value = stmt.value().accept(this);
			String target = jsName(stmt.target());
			if (declared.add(stmt.target())) {
				line("let " + target + " = " + value + ";");
			} else {
				line(target + " = " + value + ";");
			}
			return null;
		}

		@Override
		public Void visitMemberAssign(PyMemberAssignStmt stmt) {
			line(stmt.target().accept(this) + " = " + stmt.value().accept(this) + ";");
			return null;
		}

		@Override
		public Void visitExprStmt(PyExprStmt stmt) {
			String printed = stmt.value().accept(this);
			// a leading '{' would open a block statement
			if (printed.startsWith("{")) {
				printed = "(" + printed + ")";
			}
			line(printed + ";");
			return null;
		}

		@Override
		public Void visitPass(PyPassStmt stmt) {
			return null;
		}

		@Override
		public Void visitBreak(PyBreakStmt stmt) {
			line("break;");
			return null;
		}

		@Override
		public Void visitContinue(PyContinueStmt stmt) {
			line("continue;");
			return null;
		}

		@Override
		public String visitBinary(PyBinaryExpr expr) {
			String left = expr.left().accept(this);
			String right = expr.right().accept(this);
			InferredType leftType = model.typeOf(expr.left());
			InferredType rightType = model.typeOf(expr.right());
			return switch (expr.op()) {
				case ADD -> leftType == InferredType.LIST && rightType == InferredType.LIST
						? left + ".concat(" + right + ")"
						: "(" + left + " + " + right + ")";
				case MUL -> multiply(left, leftType, right, rightType);
				case FLOOR_DIV -> "Math.floor(" + left + " / " + right + ")";
				case AND -> "(" + left + " && " + right + ")";
				case OR -> "(" + left + " || " + right + ")";
				case EQ -> "(" + left + " === " + right + ")";
				case NE -> "(" + left + " !== " + right + ")";
				default -> "(" + left + " " + expr.op().symbol() + " " + right + ")";
			};
		}

		/**
		 * Sequence repetition needs the inferred operand types. A negative count repeats zero times, as in Python.
		 */
		private String multiply(String left, InferredType leftType, String right, InferredType rightType) {
			if (leftType == InferredType.STRING && rightType.isNumeric()) {
				return left + ".repeat(Math.max(0, " + right + "))";
			}
			if (leftType.isNumeric() && rightType == InferredType.STRING) {
				return right + ".repeat(Math.max(0, " + left + "))";
			}
			if (leftType == InferredType.LIST && rightType.isNumeric()) {
				return "Array(Math.max(0, " + right + ")).fill(" + left + ").flat()";
			}
			if (leftType.isNumeric() && rightType == InferredType.LIST) {
				return "Array(Math.max(0, " + left + ")).fill(" + right + ").flat()";
			}
			return "(" + left + " * " + right + ")";
		}

		@Override
		public String visitUnary(PyUnaryExpr expr) {
			String operand = expr.operand().accept(this);
			return expr.op() == UnaryOperator.NOT ? "(!" + operand + ")" : "(-" + operand + ")";
		}

		@Override
		public String visitCall(PyCallExpr expr) {
			if (expr.callee() instanceof PyNameExpr name) {
				SymbolInfo symbol = model.symbolOf(name);
				if (symbol != null && symbol.kind() == SymbolKind.BUILTIN) {
					return builtinCall(BuiltinFunction.byName(name.name()), expr.args());
				}
				if (symbol != null && symbol.kind() == SymbolKind.CLASS) {
					return "new " + name.accept(this) + "(" + arguments(expr.args()) + ")";
				}
			}
			if (expr.callee() instanceof PyAttributeExpr attribute) {
				String mapped = methodCall(attribute, expr.args());
				if (mapped != null) {
					return mapped;
				}
			}
			return expr.callee().accept(this) + "(" + arguments(expr.args()) + ")";
		}

		private String builtinCall(BuiltinFunction builtin, List<PyExpr> args) {
			String joined = arguments(args);
			switch (builtin) {
				case PRINT:
					return "console.log(" + joined + ")";
				case LEN: {
					PyExpr arg = args.get(0);
					String printed = arg.accept(this);
					return model.typeOf(arg) == InferredType.DICT
							? "Object.keys(" + printed + ").length"
							: printed + ".length";
				}
				case RANGE:
					return range(args);
				case STR:
					return args.isEmpty() ? "\"\"" : "String(" + joined + ")";
				case INT:
					return args.isEmpty() ? "0" : "Math.trunc(Number(" + joined + "))";
				case FLOAT:
					return args.isEmpty() ? "0" : "Number(" + joined + ")";
				case BOOL:
					return args.isEmpty() ? "false" : "Boolean(" + joined + ")";
				case LIST:
					return args.isEmpty() ? "[]" : "Array.from(" + joined + ")";
				case DICT:
					return "{}";
				case ABS:
					return "Math.abs(" + joined + ")";
				case MIN:
					return "Math.min(" + (args.size() == 1 ? "..." : "") + joined + ")";
				case MAX:
					return "Math.max(" + (args.size() == 1 ? "..." : "") + joined + ")";
				default:
					throw new IllegalStateException("unmapped built-in: " + builtin);
			}
		}

		/**
		 * Materializes {@code range(...)} as an array. The arrow parameters carry a '$' so they can never
		 * capture a Python name.
		 */
		private String range(List<PyExpr> args) {
			List<String> printed = new ArrayList<>();
			for (PyExpr arg : args) {
				printed.add(arg.accept(this));
			}
			if (printed.size() == 1) {
				return "Array.from({ length: " + printed.get(0) + " }, ($_, $i) => $i)";
			}
			if (args.stream().allMatch(JsPrinter::isPlainOperand)) {
				return rangeArray(printed);
			}
			// start and step are read once per element, so anything else is bound once by an arrow call
			List<String> bound = List.of("$start", "$stop", "$step").subList(0, printed.size());
			return "((" + String.join(", ", bound) + ") => " + rangeArray(bound) + ")(" + String.join(", ", printed) + ")";
		}

		private String rangeArray(List<String> operands) {
			String start = operands.get(0);
			String stop = operands.get(1);
			if (operands.size() == 2) {
				return "Array.from({ length: (" + stop + " - " + start + ") }, ($_, $i) => (" + start + " + $i))";
			}
			String step = operands.get(2);
			return "Array.from({ length: Math.ceil((" + stop + " - " + start + ") / " + step + ") }, ($_, $i) => ("
					+ start + " + ($i * " + step + ")))";
		}

		private String methodCall(PyAttributeExpr attribute, List<PyExpr> args) {
			String member = attribute.member();
			InferredType receiverType = model.typeOf(attribute.object());
			boolean listReceiver = receiverType == InferredType.LIST
					|| receiverType == InferredType.UNKNOWN && !userMethods.contains("append");
			if (member.equals("append") && listReceiver) {
				return attribute.object().accept(this) + ".push(" + arguments(args) + ")";
			}
			if (receiverType == InferredType.STRING && STRING_METHODS.containsKey(member) && args.isEmpty()) {
				return attribute.object().accept(this) + "." + STRING_METHODS.get(member) + "()";
			}
			if (receiverType == InferredType.DICT && DICT_METHODS.containsKey(member) && args.isEmpty()) {
				return DICT_METHODS.get(member) + "(" + attribute.object().accept(this) + ")";
			}
			return null;
		}

		private String arguments(List<PyExpr> args) {
			List<String> printed = new ArrayList<>();
			for (PyExpr arg : args) {
				printed.add(arg.accept(this));
			}
			return String.join(", ", printed);
		}

		@Override
		public String visitName(PyNameExpr expr) {
			if (expr.name().equals(selfName)) {
				return "this";
			}
			return jsName(expr.name());
		}

		@Override
		public String visitInt(PyIntExpr expr) {
			return expr.value().toString();
		}

		@Override
		public String visitFloat(PyFloatExpr expr) {
			double value = expr.value();
			if (Double.isInfinite(value)) {
				return "Infinity";
			}
			return Double.toString(value);
		}

		@Override
		public String visitString(PyStringExpr expr) {
			return quote(expr.value());
		}

		@Override
		public String visitBool(PyBoolExpr expr) {
			return expr.value() ? "true" : "false";
		}

		@Override
		public String visitNone(PyNoneExpr expr) {
			return "null";
		}

		@Override
		public String visitList(PyListExpr expr) {
			return "[" + arguments(expr.elements()) + "]";
		}

		@Override
		public String visitDict(PyDictExpr expr) {
			if (expr.entries().isEmpty()) {
				return "{}";
			}
			List<String> entries = new ArrayList<>();
			for (PyDictEntry entry : expr.entries()) {
				PyExpr key = entry.key();
				String printedKey = key.accept(this);
				if (!(key instanceof PyStringExpr) && !(key instanceof PyIntExpr)) {
					printedKey = "[" + printedKey + "]";
				}
				entries.add(printedKey + ": " + entry.value().accept(this));
			}
			return "{ " + String.join(", ", entries) + " }";
		}

		@Override
		public String visitAttribute(PyAttributeExpr expr) {
			return expr.object().accept(this) + "." + expr.member();
		}

		@Override
		public String visitSubscript(PySubscriptExpr expr) {
			String object = expr.object().accept(this);
			if (expr.object() instanceof PyNameExpr
					&& model.typeOf(expr.object()) != InferredType.DICT
					&& expr.index() instanceof PyUnaryExpr neg
					&& neg.op() == UnaryOperator.NEG
					&& neg.operand() instanceof PyIntExpr offset) {
				return object + "[(" + object + ".length - " + offset.value() + ")]";
			}
			return object + "[" + expr.index().accept(this) + "]";
		}

		private String joinNames(List<String> names) {
			return names.stream().map(JsPrinter::jsName).collect(Collectors.joining(", "));
		}
	}

	/** Literals and names, which can be printed more than once without changing behavior. */
	static boolean isPlainOperand(PyExpr expr) {
		return expr instanceof PyIntExpr
				|| expr instanceof PyFloatExpr
				|| expr instanceof PyNameExpr
				|| expr instanceof PyUnaryExpr neg && neg.op() == UnaryOperator.NEG && neg.operand() instanceof PyIntExpr;
	}

	/** Method names declared by any class in the program, at any depth. */
	static Set<String> methodNames(List<PyStmt> stmts) {
		Set<String> names = new HashSet<>();
		for (PyStmt stmt : stmts) {
			if (stmt instanceof PyClassDecl cls) {
				for (PyFunctionDecl method : cls.methods()) {
					names.add(method.name());
					names.addAll(methodNames(method.body()));
				}
			} else if (stmt instanceof PyFunctionDecl function) {
				names.addAll(methodNames(function.body()));
			} else if (stmt instanceof PyIfStmt branch) {
				names.addAll(methodNames(branch.thenBody()));
				names.addAll(methodNames(branch.elseBody()));
			} else if (stmt instanceof PyForStmt loop) {
				names.addAll(methodNames(loop.body()));
			} else if (stmt instanceof PyWhileStmt loop) {
				names.addAll(methodNames(loop.body()));
			}
		}
		return names;
	}

	/** Functions defined by more than one {@code def} in {@code body}, counting nested blocks. */
	static Set<String> redefinedFunctions(List<PyStmt> body) {
		Map<String, Integer> counts = new LinkedHashMap<>();
		countFunctions(body, counts);
		Set<String> redefined = new LinkedHashSet<>();
		counts.forEach((name, count) -> {
			if (count > 1) {
				redefined.add(name);
			}
		});
		return redefined;
	}

	private static void countFunctions(List<PyStmt> stmts, Map<String, Integer> counts) {
		for (PyStmt stmt : stmts) {
			if (stmt instanceof PyFunctionDecl function) {
				counts.merge(function.name(), 1, Integer::sum);
			} else if (stmt instanceof PyIfStmt branch) {
				countFunctions(branch.thenBody(), counts);
				countFunctions(branch.elseBody(), counts);
			} else if (stmt instanceof PyForStmt loop) {
				countFunctions(loop.body(), counts);
			} else if (stmt instanceof PyWhileStmt loop) {
				countFunctions(loop.body(), counts);
			}
		}
	}

	/**
	 * Names that need a {@code let} at the top of {@code body}: those first assigned inside a nested
	 * if/for/while block, and every loop variable. Already bound names are skipped. Order is first binding.
	 */
	static Set<String> hoistedNames(List<PyStmt> body, Set<String> alreadyBound) {
		Set<String> seen = new HashSet<>(alreadyBound);
		Set<String> hoisted = new LinkedHashSet<>();
		collectAssignments(body, false, seen, hoisted);
		return hoisted;
	}

	private static void collectAssignments(List<PyStmt> stmts, boolean nested, Set<String> seen, Set<String> hoisted) {
		for (PyStmt stmt : stmts) {
			if (stmt instanceof PyAssignStmt assign) {
				if (seen.add(assign.target()) && nested) {
					hoisted.add(assign.target());
				}
			} else if (stmt instanceof PyIfStmt branch) {
				collectAssignments(branch.thenBody(), true, seen, hoisted);
				collectAssignments(branch.elseBody(), true, seen, hoisted);
			} else if (stmt instanceof PyForStmt loop) {
				if (seen.add(loop.loopVar())) {
					hoisted.add(loop.loopVar());
				}
				collectAssignments(loop.body(), true, seen, hoisted);
			} else if (stmt instanceof PyWhileStmt loop) {
				collectAssignments(loop.body(), true, seen, hoisted);
			}
		}
	}

	static String quote(String value) {
		StringBuilder sb = new StringBuilder("\"");
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20 || c == 0x2028 || c == 0x2029) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.append('"').toString();
	}
}
