package org.javai.vero.ast;

public enum ClickType {
	SINGLE,
	DOUBLE,
	RIGHT
}
