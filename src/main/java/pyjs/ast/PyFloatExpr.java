package pyjs.ast;

public record PyFloatExpr(double value, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitFloat(this);
	}
}
