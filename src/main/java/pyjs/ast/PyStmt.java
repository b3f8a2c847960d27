package pyjs.ast;

public sealed interface PyStmt extends PyNode permits PyFunctionDecl, PyClassDecl, PyIfStmt, PyForStmt,
		PyWhileStmt, PyReturnStmt, PyAssignStmt, PyMemberAssignStmt, PyExprStmt, PyPassStmt, PyBreakStmt,
		PyContinueStmt {
	<R> R accept(PyStmtVisitor<R> visitor);
}
