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
package net.boyechko.pdf.autoxhtml.rules;

import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;
import net.boyechko.pdf.autoxhtml.document.Attribute;
import net.boyechko.pdf.autoxhtml.document.Node;

/**
 * Attribute-level counterpart of {@link Rule}. The first matching rule decides whether an
 * attribute of a copied element survives and under what name and value.
 */
public record AttributeRule(
        String name,
        int priority,
        BiPredicate<Node.Element, Attribute> matches,
        Function<Attribute, Optional<Attribute>> rewrite) {

    public static AttributeRule dropping(String name, int priority, String... attributeNames) {
        return new AttributeRule(
                name,
                priority,
                (owner, attribute) -> {
                    for (String attributeName : attributeNames) {
                        if (attributeName.equals(attribute.name())) return true;
                    }
                    return false;
                },
                attribute -> Optional.empty());
    }

    public static AttributeRule copying(String name, int priority) {
        return new AttributeRule(name, priority, (owner, attribute) -> true, Optional::of);
    }

    /** Renames {@code from} to {@code to} on elements named {@code elementName}. */
    public static AttributeRule renaming(
            String name, int priority, String elementName, String from, String to) {
        return new AttributeRule(
                name,
                priority,
                (owner, attribute) -> owner.hasName(elementName) && attribute.name().equals(from),
                attribute -> Optional.of(new Attribute(to, attribute.value())));
    }
}
