package pyjs.ast;

public record PyContinueStmt(SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitContinue(this);
	}
}
