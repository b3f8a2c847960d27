package pyjs.ast;

public record PyAssignStmt(String target, PyExpr value, SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitAssign(this);
	}
}
