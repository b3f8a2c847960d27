package pyjs.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pyjs.Diagnostic;
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
import pyjs.ast.SourcePosition;
import pyjs.ast.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves every name against a stack of lexical scopes and infers coarse expression types.
 *
 * Each function, class and module body is handled in two passes: all names bound anywhere in the body
 * (definitions, parameters, assignment targets, loop variables) are declared first, then expressions are
 * resolved. Type problems are reported as warnings; the first error ends the analysis.
 *
 * The analyzer keeps no state between calls, so analyzing the same tree twice gives the same result.
 */
public final class SemanticAnalyzer {
	private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

	public AnalysisResult analyze(PyProgram program) {
		Run run = new Run();
		try {
			run.analyzeProgram(program);
		} catch (SemanticException e) {
			LOG.debug("semantic analysis stopped at {}:{}: {}", e.getLine(), e.getColumn(), e.getMessage());
			run.diagnostics.add(e.toDiagnostic());
		}
		LOG.debug("semantic analysis resolved {} names, {} diagnostics", run.model.resolutions().size(),
				run.diagnostics.size());
		return new AnalysisResult(List.copyOf(run.diagnostics), run.model);
	}

	private static final class Run implements PyStmtVisitor<Void>, PyExprVisitor<InferredType> {
		private final List<Diagnostic> diagnostics = new ArrayList<>();
		private final SemanticModel model = new SemanticModel();
		private Scope scope;
		private int functionDepth;
		private int loopDepth;

		void analyzeProgram(PyProgram program) {
			Scope builtins = new Scope(null, Scope.Kind.BUILTINS);
			for (BuiltinFunction builtin : BuiltinFunction.values()) {
				builtins.define(new SymbolInfo(builtin.pythonName(), SymbolKind.BUILTIN, 0, InferredType.UNKNOWN));
			}
			scope = new Scope(builtins, Scope.Kind.MODULE);
			declareBody(program.statements());
			visitAll(program.statements());
		}

		private void declareBody(List<PyStmt> body) {
			for (PyStmt stmt : body) {
				if (stmt instanceof PyFunctionDecl fn) {
					declare(fn.name(), SymbolKind.FUNCTION, fn.position());
				} else if (stmt instanceof PyClassDecl cls) {
					declare(cls.name(), SymbolKind.CLASS, cls.position());
				} else if (stmt instanceof PyAssignStmt assign) {
					declare(assign.target(), SymbolKind.VARIABLE, assign.position());
				} else if (stmt instanceof PyForStmt loop) {
					declare(loop.loopVar(), SymbolKind.VARIABLE, loop.position());
					declareBody(loop.body());
				} else if (stmt instanceof PyWhileStmt loop) {
					declareBody(loop.body());
				} else if (stmt instanceof PyIfStmt branch) {
					declareBody(branch.thenBody());
					declareBody(branch.elseBody());
				}
			}
		}

		private void declare(String name, SymbolKind kind, SourcePosition position) {
			SymbolInfo existing = scope.lookupLocal(name);
			if (existing == null) {
				scope.define(new SymbolInfo(name, kind, position.line(), InferredType.UNKNOWN));
				return;
			}
			if (!existing.kind().canRebindAs(kind)) {
				throw new SemanticException("redeclaration of '" + name + "' as a " + kind.displayName()
						+ " (declared as a " + existing.kind().displayName() + " at line "
						+ existing.declaredAtLine() + ")", position);
			}
		}

		private void visitAll(List<PyStmt> stmts) {
			for (PyStmt stmt : stmts) {
				stmt.accept(this);
			}
		}

		private void warn(SourcePosition position, String message) {
			diagnostics.add(Diagnostic.warning(Diagnostic.Stage.SEMANTIC, position, message));
		}

		@Override
		public Void visitFunctionDecl(PyFunctionDecl stmt) {
			Scope saved = scope;
			int savedLoops = loopDepth;
			scope = new Scope(saved, Scope.Kind.FUNCTION);
			for (String param : stmt.parameters()) {
				declare(param, SymbolKind.PARAMETER, stmt.position());
			}
			declareBody(stmt.body());
			functionDepth++;
			loopDepth = 0;
			try {
				visitAll(stmt.body());
			} finally {
				functionDepth--;
				loopDepth = savedLoops;
				scope = saved;
			}
			return null;
		}

		@Override
		public Void visitClassDecl(PyClassDecl stmt) {
			Scope saved = scope;
			scope = new Scope(saved, Scope.Kind.CLASS);
			try {
				for (PyFunctionDecl method : stmt.methods()) {
					declare(method.name(), SymbolKind.FUNCTION, method.position());
				}
				for (PyFunctionDecl method : stmt.methods()) {
					visitFunctionDecl(method);
				}
			} finally {
				scope = saved;
			}
			return null;
		}

		@Override
		public Void visitIf(PyIfStmt stmt) {
			stmt.condition().accept(this);
			visitAll(stmt.thenBody());
			visitAll(stmt.elseBody());
			return null;
		}

		@Override
		public Void visitFor(PyForStmt stmt) {
			InferredType iterableType = stmt.iterable().accept(this);
			InferredType elementType = InferredType.UNKNOWN;
			if (stmt.iterable() instanceof PyCallExpr call && model.isBuiltinCall(call.callee(), BuiltinFunction.RANGE)) {
				elementType = InferredType.NUMBER;
			} else if (iterableType == InferredType.STRING || iterableType == InferredType.DICT) {
				elementType = InferredType.STRING;
			} else if (iterableType.isNumeric()) {
				warn(stmt.iterable().position(), "possible type mismatch: a " + iterableType.displayName()
						+ " is not iterable");
			}
			scope.recordAssignment(stmt.loopVar(), elementType);

			loopDepth++;
			try {
				visitAll(stmt.body());
			} finally {
				loopDepth--;
			}
			return null;
		}

		@Override
		public Void visitWhile(PyWhileStmt stmt) {
			stmt.condition().accept(this);
			loopDepth++;
			try {
				visitAll(stmt.body());
			} finally {
				loopDepth--;
			}
			return null;
		}

		@Override
		public Void visitReturn(PyReturnStmt stmt) {
			if (functionDepth == 0) {
				throw new SemanticException("'return' outside function", stmt.position());
			}
			if (stmt.hasValue()) {
				stmt.value().accept(this);
			}
			return null;
		}

		@Override
		public Void visitAssign(PyAssignStmt stmt) {
			InferredType type = stmt.value().accept(this);
			scope.recordAssignment(stmt.target(), type);
			return null;
		}

		@Override
		public Void visitMemberAssign(PyMemberAssignStmt stmt) {
			stmt.target().accept(this);
			stmt.value().accept(this);
			return null;
		}

		@Override
		public Void visitExprStmt(PyExprStmt stmt) {
			stmt.value().accept(this);
			return null;
		}

		@Override
		public Void visitPass(PyPassStmt stmt) {
			return null;
		}

		@Override
		public Void visitBreak(PyBreakStmt stmt) {
			if (loopDepth == 0) {
				throw new SemanticException("'break' outside loop", stmt.position());
			}
			return null;
		}

		@Override
		public Void visitContinue(PyContinueStmt stmt) {
			if (loopDepth == 0) {
				throw new SemanticException("'continue' not properly in loop", stmt.position());
			}
			return null;
		}

		private InferredType typed(PyExpr expr, InferredType type) {
			model.recordType(expr, type);
			return type;
		}

		@Override
		public InferredType visitBinary(PyBinaryExpr expr) {
			InferredType left = expr.left().accept(this);
			InferredType right = expr.right().accept(this);
			InferredType result = TypeRules.binary(expr.op(), left, right);
			if (result == null) {
				warn(expr.position(), "possible type mismatch: unsupported operand types for "
						+ expr.op().symbol() + ": '" + left.displayName() + "' and '" + right.displayName() + "'");
				result = expr.op().isComparison() ? InferredType.BOOL : InferredType.UNKNOWN;
			}
			return typed(expr, result);
		}

		@Override
		public InferredType visitUnary(PyUnaryExpr expr) {
			InferredType operand = expr.operand().accept(this);
			if (expr.op() == UnaryOperator.NOT) {
				return typed(expr, InferredType.BOOL);
			}
			if (operand.isKnown() && !operand.isNumeric()) {
				warn(expr.position(), "possible type mismatch: bad operand type for unary -: '"
						+ operand.displayName() + "'");
				return typed(expr, InferredType.UNKNOWN);
			}
			return typed(expr, InferredType.NUMBER);
		}

		@Override
		public InferredType visitCall(PyCallExpr expr) {
			expr.callee().accept(this);
			List<InferredType> argTypes = new ArrayList<>();
			for (PyExpr arg : expr.args()) {
				argTypes.add(arg.accept(this));
			}

			if (expr.callee() instanceof PyNameExpr name) {
				SymbolInfo symbol = model.symbolOf(name);
				if (symbol.kind() == SymbolKind.BUILTIN) {
					return typed(expr, checkBuiltinCall(BuiltinFunction.byName(name.name()), expr, argTypes));
				}
			}
			return typed(expr, InferredType.UNKNOWN);
		}

		private InferredType checkBuiltinCall(BuiltinFunction builtin, PyCallExpr call, List<InferredType> argTypes) {
			if (!builtin.acceptsArgumentCount(argTypes.size())) {
				throw new SemanticException(builtin.pythonName() + "() takes " + builtin.describeArity() + " ("
						+ argTypes.size() + " given)", call.position());
			}
			if (builtin == BuiltinFunction.LEN && argTypes.get(0).isNumeric()) {
				warn(call.position(), "possible type mismatch: object of type '" + argTypes.get(0).displayName()
						+ "' has no len()");
			}
			if (builtin == BuiltinFunction.RANGE) {
				for (int i = 0; i < argTypes.size(); i++) {
					InferredType t = argTypes.get(i);
					if (t.isKnown() && !t.isNumeric()) {
						warn(call.args().get(i).position(), "possible type mismatch: range() argument is a '"
								+ t.displayName() + "'");
					}
				}
			}
			return builtin.resultType();
		}

		@Override
		public InferredType visitName(PyNameExpr expr) {
			SymbolInfo symbol = scope.lookup(expr.name());
			if (symbol == null) {
				throw new SemanticException("undefined name '" + expr.name() + "'", expr.position());
			}
			model.resolve(expr, symbol);
			return typed(expr, symbol.kind().isValue() ? symbol.inferredType() : InferredType.UNKNOWN);
		}

		@Override
		public InferredType visitInt(PyIntExpr expr) {
			return typed(expr, InferredType.NUMBER);
		}

		@Override
		public InferredType visitFloat(PyFloatExpr expr) {
			return typed(expr, InferredType.NUMBER);
		}

		@Override
		public InferredType visitString(PyStringExpr expr) {
			return typed(expr, InferredType.STRING);
		}

		@Override
		public InferredType visitBool(PyBoolExpr expr) {
			return typed(expr, InferredType.BOOL);
		}

		@Override
		public InferredType visitNone(PyNoneExpr expr) {
			return typed(expr, InferredType.UNKNOWN);
		}

		@Override
		public InferredType visitList(PyListExpr expr) {
			for (PyExpr element : expr.elements()) {
				element.accept(this);
			}
			return typed(expr, InferredType.LIST);
		}

		@Override
		public InferredType visitDict(PyDictExpr expr) {
			for (PyDictEntry entry : expr.entries()) {
				entry.key().accept(this);
				entry.value().accept(this);
			}
			return typed(expr, InferredType.DICT);
		}

		@Override
		public InferredType visitAttribute(PyAttributeExpr expr) {
			expr.object().accept(this);
			return typed(expr, InferredType.UNKNOWN);
		}

		@Override
		public InferredType visitSubscript(PySubscriptExpr expr) {
			InferredType object = expr.object().accept(this);
			expr.index().accept(this);
			if (object.isNumeric()) {
				warn(expr.position(), "possible type mismatch: '" + object.displayName()
						+ "' object is not subscriptable");
			}
			return typed(expr, object == InferredType.STRING ? InferredType.STRING : InferredType.UNKNOWN);
		}
	}
}
