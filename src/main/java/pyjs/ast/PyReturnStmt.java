package pyjs.ast;

/**
 * {@code return} with an optional value; a bare {@code return} has a null value.
 */
public record PyReturnStmt(PyExpr value, SourcePosition position) implements PyStmt {
	public boolean hasValue() {
		return value != null;
	}

	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitReturn(this);
	}
}
