package pyjs.ast;

import java.math.BigInteger;

public record PyIntExpr(BigInteger value, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitInt(this);
	}
}
