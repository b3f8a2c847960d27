package pyjs.ast;

public record PyBreakStmt(SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitBreak(this);
	}
}
