package pyjs.ast;

/**
 * One method per statement variant. Every pipeline stage that walks statements implements this, so a
 * new variant does not compile until each stage handles it.
 */
public interface PyStmtVisitor<R> {
	R visitFunctionDecl(PyFunctionDecl stmt);

	R visitClassDecl(PyClassDecl stmt);

	R visitIf(PyIfStmt stmt);

	R visitFor(PyForStmt stmt);

	R visitWhile(PyWhileStmt stmt);

	R visitReturn(PyReturnStmt stmt);

	R visitAssign(PyAssignStmt stmt);

	R visitMemberAssign(PyMemberAssignStmt stmt);

	R visitExprStmt(PyExprStmt stmt);

	R visitPass(PyPassStmt stmt);

	R visitBreak(PyBreakStmt stmt);

	R visitContinue(PyContinueStmt stmt);
}
