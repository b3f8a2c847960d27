package pyjs.ast;

public record PyExprStmt(PyExpr value, SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitExprStmt(this);
	}
}
