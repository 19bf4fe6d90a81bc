/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting.property;

import com.vaticle.reqmachine.common.exception.ReqMachineException;
import com.vaticle.reqmachine.rewriting.MutableTerm;
import com.vaticle.reqmachine.rewriting.RewritePath;
import com.vaticle.reqmachine.rewriting.RewriteStep;
import com.vaticle.reqmachine.rewriting.RewriteSystem;
import com.vaticle.reqmachine.rewriting.Rule;
import com.vaticle.reqmachine.rewriting.Symbol;
import com.vaticle.reqmachine.rewriting.Term;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Rewriting.NOT_A_PROPERTY_SYMBOL;

class ConcreteConformanceRule {

    private final RewriteSystem system;

    ConcreteConformanceRule(RewriteSystem system) {
        this.system = system;
    }

    /**
     * Given the rules {@code T.[concrete: C] => T} and {@code T'.[P] => T'}, where one of {@code T} and {@code T'}
     * is a suffix of the other, adds the rule {@code T''.[concrete: C : P] => T''} for the longer of the two.
     */
    void recordConcreteConformanceRule(int concreteRuleID, int conformanceRuleID, Symbol concreteConformanceSymbol) {
        Rule concreteRule = system.getRule(concreteRuleID);
        Rule conformanceRule = system.getRule(conformanceRuleID);

        RewritePath path = new RewritePath();
        Term rhs = concreteRule.rhs().size() > conformanceRule.rhs().size() ? concreteRule.rhs() : conformanceRule.rhs();

        // T'' => T''.[P]
        path.add(RewriteStep.forRewriteRule(rhs.size() - conformanceRule.rhs().size(), 0, conformanceRuleID, true));
        // T''.[P] => T''.[concrete: C].[P]
        path.add(RewriteStep.forRewriteRule(rhs.size() - concreteRule.rhs().size(), 1, concreteRuleID, true));

        Symbol concreteSymbol = propertySymbol(concreteRule);
        int prefixLength = rhs.size() - concreteRule.rhs().size();
        if (prefixLength > 0 && !concreteConformanceSymbol.substitutions().isEmpty()) {
            path.add(RewriteStep.forPrefixSubstitutions(prefixLength, 1, false));
            concreteSymbol = concreteSymbol.prependPrefixToConcreteSubstitutions(rhs.prefix(prefixLength));
        }

        Symbol protocolSymbol = propertySymbol(conformanceRule);
        // T''.[concrete: C].[P] => T''.[concrete: C : P]
        int relationID = system.recordConcreteConformanceRelation(concreteSymbol, protocolSymbol,
                                                                  concreteConformanceSymbol);
        path.add(RewriteStep.forRelation(rhs.size(), relationID, false));

        MutableTerm lhs = new MutableTerm(rhs);
        lhs.add(concreteConformanceSymbol);

        // built from the right hand side to the left hand side
        path.invert();
        system.addRule(lhs, new MutableTerm(rhs), path);
    }

    private static Symbol propertySymbol(Rule rule) {
        return rule.isPropertyRule().orElseThrow(() -> ReqMachineException.of(NOT_A_PROPERTY_SYMBOL, rule.lhs().last()));
    }
}
