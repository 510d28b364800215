package org.javai.vero.codegen;

import java.util.List;
import org.javai.vero.ast.StatementNode;

final class FrameSwitches {

	private FrameSwitches() {
	}

	/**
	 * Whether any statement, at any nesting level, changes the active frame.
	 */
	static boolean containsSwitch(List<StatementNode> statements) {
		for (StatementNode statement : statements) {
			if (statement instanceof StatementNode.SwitchToFrame || statement instanceof StatementNode.SwitchToMainFrame) {
				return true;
			}
			if (statement instanceof StatementNode.If ifStatement
					&& (containsSwitch(ifStatement.thenBranch()) || containsSwitch(ifStatement.elseBranch()))) {
				return true;
			}
			if (statement instanceof StatementNode.ForLoop forLoop && containsSwitch(forLoop.body())) {
				return true;
			}
			if (statement instanceof StatementNode.WhileLoop whileLoop && containsSwitch(whileLoop.body())) {
				return true;
			}
		}
		return false;
	}
}
