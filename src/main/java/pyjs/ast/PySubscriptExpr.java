package pyjs.ast;

public record PySubscriptExpr(PyExpr object, PyExpr index, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitSubscript(this);
	}
}
