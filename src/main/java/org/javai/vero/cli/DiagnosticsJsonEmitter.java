package org.javai.vero.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import org.javai.vero.diagnostics.Diagnostic;

/**
 * Renders per-file diagnostics as a JSON document for editor integrations:
 * <pre>
 * { "errorCount": 1,
 *   "files": [ { "file": "login.vero", "diagnostics": [
 *     { "kind": "SYNTAX", "severity": "ERROR", "message": "...", "line": 3, "column": 5, "offset": 42 } ] } ] }
 * </pre>
 */
final class DiagnosticsJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private DiagnosticsJsonEmitter() {
	}

	static String emit(Map<String, List<Diagnostic>> diagnosticsByFile) {
		ObjectNode root = mapper.createObjectNode();
		ArrayNode files = mapper.createArrayNode();
		int errorCount = 0;
		for (Map.Entry<String, List<Diagnostic>> entry : diagnosticsByFile.entrySet()) {
			ObjectNode file = mapper.createObjectNode();
			file.put("file", entry.getKey());
			ArrayNode diagnostics = file.putArray("diagnostics");
			for (Diagnostic diagnostic : entry.getValue()) {
				diagnostics.add(toNode(diagnostic));
				errorCount++;
			}
			files.add(file);
		}
		root.put("errorCount", errorCount);
		root.set("files", files);
		return root.toPrettyString();
	}

	private static ObjectNode toNode(Diagnostic diagnostic) {
		ObjectNode node = mapper.createObjectNode();
		node.put("kind", diagnostic.kind().name());
		node.put("severity", diagnostic.severity().name());
		node.put("message", diagnostic.message());
		node.put("line", diagnostic.position().line());
		node.put("column", diagnostic.position().column());
		node.put("offset", diagnostic.position().offset());
		return node;
	}
}
