package pyjs.ast;

public interface PyExprVisitor<R> {
	R visitBinary(PyBinaryExpr expr);

	R visitUnary(PyUnaryExpr expr);

	R visitCall(PyCallExpr expr);

	R visitName(PyNameExpr expr);

	R visitInt(PyIntExpr expr);

	R visitFloat(PyFloatExpr expr);

	R visitString(PyStringExpr expr);

	R visitBool(PyBoolExpr expr);

	R visitNone(PyNoneExpr expr);

	R visitList(PyListExpr expr);

	R visitDict(PyDictExpr expr);

	R visitAttribute(PyAttributeExpr expr);

	R visitSubscript(PySubscriptExpr expr);
}
