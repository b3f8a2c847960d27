package pyjs.ast;

import java.util.List;

public record PyListExpr(List<PyExpr> elements, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitList(this);
	}
}
