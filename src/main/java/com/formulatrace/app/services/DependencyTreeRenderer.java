package com.formulatrace.app.services;

import com.formulatrace.app.models.DependencyNode;
import com.formulatrace.app.models.TraceMode;
import com.formulatrace.app.models.TraceResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a trace result as plain text with box-drawing connectors:
 *
 * <pre>
 * Precedents tree for Sheet1!C1:
 *
 * └── Sheet1!C1 (=A1+B1)
 *     ├── Sheet1!A1 = 10
 *     └── Sheet1!B1 = 20
 * </pre>
 */
@Component
public class DependencyTreeRenderer {

    public String render(TraceResult result) {
        if (!result.hasRoot()) {
            return result.getMessage();
        }
        DependencyNode root = result.getRoot();
        List<String> lines = new ArrayList<>();
        lines.add(result.getMode().heading() + " tree for " + root.getAddress() + ":");
        lines.add("");
        renderNode(root, lines, "", true);

        if (result.getMode() == TraceMode.DEPENDENTS && root.getChildren().isEmpty()) {
            lines.add("");
            lines.add("No direct dependents found.");
        }
        if (result.isTruncated()) {
            lines.add("");
            if (result.getSkippedSheets().isEmpty()) {
                lines.add("Trace output was truncated to keep the result responsive.");
            } else {
                lines.add("Trace output was truncated; sheets not scanned: "
                        + String.join(", ", result.getSkippedSheets()) + ".");
            }
        }
        return String.join("\n", lines);
    }

    private void renderNode(DependencyNode node, List<String> lines, String prefix, boolean isLast) {
        StringBuilder line = new StringBuilder(prefix)
                .append(isLast ? "└── " : "├── ")
                .append(node.getAddress());
        String value = formatValue(node.getValue());
        if (!value.isEmpty()) {
            line.append(" = ").append(value);
        }
        if (node.getFormula() != null) {
            line.append(" (").append(node.getFormula()).append(')');
        }
        lines.add(line.toString());

        String childPrefix = prefix + (isLast ? "    " : "│   ");
        List<DependencyNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            renderNode(children.get(i), lines, childPrefix, i == children.size() - 1);
        }
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }
}
