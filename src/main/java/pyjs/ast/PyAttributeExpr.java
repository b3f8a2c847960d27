package pyjs.ast;

public record PyAttributeExpr(PyExpr object, String member, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitAttribute(this);
	}
}
