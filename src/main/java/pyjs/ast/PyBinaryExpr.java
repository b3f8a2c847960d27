package pyjs.ast;

public record PyBinaryExpr(BinaryOperator op, PyExpr left, PyExpr right, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitBinary(this);
	}
}
