package org.javai.vero.ast;

public enum HookType {
	BEFORE_EACH,
	AFTER_EACH,
	BEFORE_ALL,
	AFTER_ALL
}
