package pyjs.ast;

public record PyUnaryExpr(UnaryOperator op, PyExpr operand, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitUnary(this);
	}
}
