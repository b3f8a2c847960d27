package pyjs.ast;

public record PyStringExpr(String value, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitString(this);
	}
}
