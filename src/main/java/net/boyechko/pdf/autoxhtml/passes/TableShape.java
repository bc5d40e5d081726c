/*
 * PDF-Auto-XHTML - Tagged PDF to XHTML Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autoxhtml.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Node;

/**
 * Row and cell geometry of an output {@code table}. Rows are the {@code tr} children of the
 * table itself and of its {@code thead}, {@code tbody} and {@code tfoot}; rows of nested tables
 * belong to those tables.
 */
public final class TableShape {
    private static final String[] ROW_GROUPS = {"thead", "tbody", "tfoot"};

    private TableShape() {}

    public static boolean isCell(Node node) {
        return node instanceof Node.Element e && e.hasAnyName("td", "th");
    }

    public static List<Node.Element> cells(Node.Element row) {
        return row.elementChildren().stream().filter(TableShape::isCell).toList();
    }

    /** Width of a row: the sum of its cells' {@code colspan}, invalid or missing counting 1. */
    public static int cellCount(Node.Element row) {
        int count = 0;
        for (Node.Element cell : cells(row)) {
            count += colspan(cell);
        }
        return count;
    }

    static int colspan(Node.Element cell) {
        return cell.attribute("colspan").map(TableShape::positiveOrOne).orElse(1);
    }

    private static int positiveOrOne(String value) {
        try {
            int parsed = Integer.parseInt(value.strip());
            return parsed > 0 ? parsed : 1;
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    /** Rows in document order. */
    public static List<Node.Element> rows(Node.Element table) {
        List<Node.Element> rows = new ArrayList<>();
        for (Node.Element child : table.elementChildren()) {
            if (child.hasName("tr")) {
                rows.add(child);
            } else if (child.hasAnyName(ROW_GROUPS)) {
                rows.addAll(child.elementChildren("tr"));
            }
        }
        return rows;
    }

    /**
     * The header row: the first row of the {@code thead} when there is one, otherwise the first
     * row of the table. Returns null for a table without rows.
     */
    public static Node.Element headerRow(Node.Element table) {
        for (Node.Element child : table.elementChildren("thead")) {
            List<Node.Element> headRows = child.elementChildren("tr");
            if (!headRows.isEmpty()) {
                return headRows.get(0);
            }
        }
        List<Node.Element> rows = rows(table);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** Width every row of the table is expected to have; 0 for a table without rows. */
    public static int expectedCount(Node.Element table) {
        Node.Element header = headerRow(table);
        return header != null ? cellCount(header) : 0;
    }

    /** The expected width recorded on a row by the cleanup pass, or -1. */
    static int recordedExpectedCount(Node.Element row) {
        return row.attribute(Annotations.EXPECTED_COUNT)
                .map(
                        value -> {
                            try {
                                return Integer.parseInt(value.strip());
                            } catch (NumberFormatException e) {
                                return -1;
                            }
                        })
                .orElse(-1);
    }

    /** Returns the table with {@code rowMapper} applied to each of its rows. */
    public static Node.Element mapRows(Node.Element table, UnaryOperator<Node.Element> rowMapper) {
        List<Node> children = new ArrayList<>(table.children().size());
        for (Node child : table.children()) {
            if (child instanceof Node.Element e && e.hasName("tr")) {
                children.add(rowMapper.apply(e));
            } else if (child instanceof Node.Element e && e.hasAnyName(ROW_GROUPS)) {
                children.add(mapGroupRows(e, rowMapper));
            } else {
                children.add(child);
            }
        }
        return table.withChildren(children);
    }

    private static Node.Element mapGroupRows(
            Node.Element group, UnaryOperator<Node.Element> rowMapper) {
        List<Node> children = new ArrayList<>(group.children().size());
        for (Node child : group.children()) {
            if (child instanceof Node.Element e && e.hasName("tr")) {
                children.add(rowMapper.apply(e));
            } else {
                children.add(child);
            }
        }
        return group.withChildren(children);
    }
}
