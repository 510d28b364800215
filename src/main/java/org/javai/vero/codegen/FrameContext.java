package org.javai.vero.codegen;

/**
 * Which frame locator-based statements resolve in at a given point of the generated test.
 * Immutable: each statement receives a context and returns the one in effect after it.
 *
 * @param depth number of frames entered since the last reset; 0 is the top-level page
 * @param ambiguous whether control flow reaches this point from both inside and outside a
 * frame, in which case the choice is deferred to run time
 */
public record FrameContext(int depth, boolean ambiguous) {

	private static final FrameContext ROOT = new FrameContext(0, false);

	public FrameContext {
		if (depth < 0) {
			throw new IllegalArgumentException("depth must not be negative");
		}
	}

	public static FrameContext root() {
		return ROOT;
	}

	public FrameContext enter() {
		return new FrameContext(depth + 1, false);
	}

	/**
	 * Context after two control-flow paths join.
	 */
	public FrameContext merge(FrameContext other) {
		if (equals(other)) {
			return this;
		}
		int deepest = Math.max(depth, other.depth);
		boolean bothInFrame = depth > 0 && other.depth > 0 && !ambiguous && !other.ambiguous;
		return new FrameContext(deepest, !bothInFrame);
	}

	/**
	 * Context at the top of a loop body that may switch frames.
	 */
	public FrameContext unsettled() {
		return new FrameContext(depth, true);
	}

	/**
	 * Expression locators are resolved from.
	 */
	public String rootExpression() {
		if (ambiguous) {
			return "(frame ?? page)";
		}
		return depth == 0 ? "page" : "frame!";
	}
}
