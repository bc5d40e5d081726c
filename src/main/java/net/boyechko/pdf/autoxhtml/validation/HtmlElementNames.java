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
package net.boyechko.pdf.autoxhtml.validation;

import java.util.Set;

/** Element names of HTML5, as written in XHTML (lowercase). */
public final class HtmlElementNames {
    private HtmlElementNames() {}

    private static final Set<String> NAMES =
            Set.of(
                    // Document and metadata
                    "html", "head", "title", "base", "link", "meta", "style", "script",
                    "noscript", "template", "body",
                    // Sections
                    "article", "section", "nav", "aside", "h1", "h2", "h3", "h4", "h5", "h6",
                    "hgroup", "header", "footer", "address", "main",
                    // Grouping
                    "p", "hr", "pre", "blockquote", "ol", "ul", "menu", "li", "dl", "dt", "dd",
                    "figure", "figcaption", "div",
                    // Text-level
                    "a", "em", "strong", "small", "s", "cite", "q", "dfn", "abbr", "ruby", "rt",
                    "rp", "data", "time", "code", "var", "samp", "kbd", "sub", "sup", "i", "b",
                    "u", "mark", "bdi", "bdo", "span", "br", "wbr",
                    // Edits
                    "ins", "del",
                    // Embedded content
                    "picture", "source", "img", "iframe", "embed", "object", "param", "video",
                    "audio", "track", "map", "area", "svg", "math", "canvas",
                    // Tables
                    "table", "caption", "colgroup", "col", "tbody", "thead", "tfoot", "tr",
                    "td", "th",
                    // Forms
                    "form", "label", "input", "button", "select", "datalist", "optgroup",
                    "option", "textarea", "output", "progress", "meter", "fieldset", "legend",
                    // Interactive
                    "details", "summary", "dialog", "slot");

    public static boolean isHtmlElement(String name) {
        return NAMES.contains(name);
    }
}
