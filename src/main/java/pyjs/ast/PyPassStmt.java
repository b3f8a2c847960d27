package pyjs.ast;

public record PyPassStmt(SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitPass(this);
	}
}
