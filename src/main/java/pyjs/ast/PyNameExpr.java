package pyjs.ast;

public record PyNameExpr(String name, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitName(this);
	}
}
