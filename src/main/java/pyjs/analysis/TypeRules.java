package pyjs.analysis;

import pyjs.ast.BinaryOperator;

/**
 * Result types of binary operators over {@link InferredType}.
 */
final class TypeRules {
	private TypeRules() {
	}

	/**
	 * Returns the result type of {@code left op right}, or null when the operand types are known and the
	 * operator certainly does not apply to them.
	 */
	static InferredType binary(BinaryOperator op, InferredType left, InferredType right) {
		switch (op) {
			case EQ:
			case NE:
				return InferredType.BOOL;
			case AND:
			case OR:
				return left == right ? left : InferredType.UNKNOWN;
			default:
				break;
		}

		if (!left.isKnown() || !right.isKnown()) {
			return op.isComparison() ? InferredType.BOOL : InferredType.UNKNOWN;
		}

		if (op.isComparison()) {
			boolean ordered = (left.isNumeric() && right.isNumeric())
					|| (left == right && (left == InferredType.STRING || left == InferredType.LIST));
			return ordered ? InferredType.BOOL : null;
		}

		if (left.isNumeric() && right.isNumeric()) {
			return InferredType.NUMBER;
		}

		switch (op) {
			case ADD:
				if (left == right && (left == InferredType.STRING || left == InferredType.LIST)) {
					return left;
				}
				return null;
			case MUL:
				if (isSequence(left) && right.isNumeric()) {
					return left;
				}
				if (left.isNumeric() && isSequence(right)) {
					return right;
				}
				return null;
			case MOD:
				// printf-style formatting has no JavaScript counterpart
				return null;
			default:
				return null;
		}
	}

	private static boolean isSequence(InferredType t) {
		return t == InferredType.STRING || t == InferredType.LIST;
	}
}
