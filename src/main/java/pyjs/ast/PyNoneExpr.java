package pyjs.ast;

public record PyNoneExpr(SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitNone(this);
	}
}
