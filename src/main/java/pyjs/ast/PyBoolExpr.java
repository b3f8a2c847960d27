package pyjs.ast;

public record PyBoolExpr(boolean value, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitBool(this);
	}
}
