package org.javai.vero.diagnostics;

public enum Severity {
	ERROR
}
