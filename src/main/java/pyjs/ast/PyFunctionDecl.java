package pyjs.ast;

import java.util.List;

public record PyFunctionDecl(String name, List<String> parameters, List<PyStmt> body, SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitFunctionDecl(this);
	}
}
