package pyjs.ast;

import java.util.List;

public record PyClassDecl(String name, List<PyFunctionDecl> methods, SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitClassDecl(this);
	}
}
