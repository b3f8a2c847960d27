package pyjs.ast;

public sealed interface PyExpr extends PyNode permits PyBinaryExpr, PyUnaryExpr, PyCallExpr, PyNameExpr,
		PyIntExpr, PyFloatExpr, PyStringExpr, PyBoolExpr, PyNoneExpr, PyListExpr, PyDictExpr, PyAttributeExpr,
		PySubscriptExpr {
	<R> R accept(PyExprVisitor<R> visitor);
}
