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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import net.boyechko.pdf.autoxhtml.document.Attribute;
import net.boyechko.pdf.autoxhtml.document.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ordered rules of one scope, with {@link BaseRules} merged in at construction.
 *
 * <p>Rules are tried by descending priority, then descending pattern specificity, then
 * registration order; the first rule whose pattern matches and whose handler does not fall
 * through decides the rewrite. The identity rules at the end of every table make dispatch total.
 */
public final class RuleTable {
    private static final Logger logger = LoggerFactory.getLogger(RuleTable.class);

    private final Scope scope;
    private final List<Rule> rules;
    private final List<AttributeRule> attributeRules;

    private RuleTable(Scope scope, List<Rule> rules, List<AttributeRule> attributeRules) {
        this.scope = scope;
        this.rules = List.copyOf(rules);
        this.attributeRules = List.copyOf(attributeRules);
    }

    public static Builder builder(Scope scope) {
        return new Builder(scope);
    }

    public static class Builder {
        private final Scope scope;
        private final List<Rule> rules = new ArrayList<>();
        private final List<AttributeRule> attributeRules = new ArrayList<>();

        private Builder(Scope scope) {
            this.scope = scope;
        }

        public Builder add(RuleSet ruleSet) {
            rules.addAll(ruleSet.rules());
            attributeRules.addAll(ruleSet.attributeRules());
            return this;
        }

        public Builder add(Rule rule) {
            rules.add(rule);
            return this;
        }

        public Builder add(AttributeRule rule) {
            attributeRules.add(rule);
            return this;
        }

        public RuleTable build() {
            List<Rule> merged = new ArrayList<>(rules);
            merged.addAll(BaseRules.INSTANCE.rules());
            List<AttributeRule> mergedAttributes = new ArrayList<>(attributeRules);
            mergedAttributes.addAll(BaseRules.INSTANCE.attributeRules());

            // List.sort is stable, so registration order survives as the last tie-breaker
            merged.sort(
                    Comparator.comparingInt(Rule::priority)
                            .reversed()
                            .thenComparing(
                                    Comparator.comparingInt((Rule r) -> r.pattern().specificity())
                                            .reversed()));
            mergedAttributes.sort(Comparator.comparingInt(AttributeRule::priority).reversed());
            return new RuleTable(scope, merged, mergedAttributes);
        }
    }

    public Scope scope() {
        return scope;
    }

    /** Rules in dispatch order. */
    public List<Rule> rules() {
        return rules;
    }

    /** Rewrites one node; the result may be empty, a single node or a promoted sequence. */
    public List<Node> apply(Node node, RuleContext ctx) {
        for (Rule rule : rules) {
            if (!rule.matches(node, ctx)) {
                continue;
            }
            RuleOutcome outcome = rule.handler().apply(node, ctx);
            if (outcome instanceof RuleOutcome.Matched matched) {
                return matched.nodes();
            }
            logger.trace("{}: {} fell through at {}", scope, rule.name(), ctx.path());
        }
        // Unreachable while the identity rules are present
        throw new IllegalStateException("No rule in " + scope + " rewrote " + ctx.path());
    }

    public Optional<Attribute> applyAttribute(
            Node.Element owner, Attribute attribute, RuleContext ctx) {
        for (AttributeRule rule : attributeRules) {
            if (rule.matches().test(owner, attribute)) {
                return rule.rewrite().apply(attribute);
            }
        }
        return Optional.of(attribute);
    }
}
