/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting.property;

import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.ast.RequirementKind;
import com.vaticle.reqmachine.common.collection.Pair;
import com.vaticle.reqmachine.common.parameters.Options;
import com.vaticle.reqmachine.conformance.ProtocolConformance;
import com.vaticle.reqmachine.rewriting.MutableTerm;
import com.vaticle.reqmachine.rewriting.RequirementDesugarer;
import com.vaticle.reqmachine.rewriting.RequirementError;
import com.vaticle.reqmachine.rewriting.RequirementLowering;
import com.vaticle.reqmachine.rewriting.RewriteContext;
import com.vaticle.reqmachine.rewriting.RewriteSystem;
import com.vaticle.reqmachine.rewriting.RuleBuilder;
import com.vaticle.reqmachine.rewriting.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.vaticle.reqmachine.common.parameters.DebugFlags.CONDITIONAL_REQUIREMENTS;

/**
 * If a key is fixed to a concrete type that conforms to one of its protocols only conditionally, the conditional
 * requirements of that conformance also hold for the key's type parameters.
 */
class ConditionalRequirementInference {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionalRequirementInference.class);

    private final PropertyMap map;
    private final RewriteSystem system;
    private final RewriteContext context;
    private final Options options;
    private final RequirementDesugarer desugarer;
    private final RequirementLowering lowering;

    ConditionalRequirementInference(PropertyMap map) {
        this.map = map;
        this.system = map.system();
        this.context = map.context();
        this.options = map.options();
        this.desugarer = new RequirementDesugarer(context.conformances());
        this.lowering = new RequirementLowering(context);
    }

    void inferConditionalRequirements(ProtocolConformance concrete, List<Term> substitutions) {
        if (!options.inferConditionalRequirements()) return;

        List<Requirement> conditionalRequirements = concrete.getConditionalRequirements();
        if (options.debug(CONDITIONAL_REQUIREMENTS)) {
            LOG.debug("@@ {} conditional requirements from {} : {}", conditionalRequirements.isEmpty() ? "No" : "Inferring",
                      concrete.getType(), concrete.getProtocol().name());
        }
        if (conditionalRequirements.isEmpty()) return;

        List<Requirement> desugaredRequirements = new ArrayList<>();
        List<RequirementError> errors = new ArrayList<>();
        for (Requirement req : conditionalRequirements) {
            if (options.debug(CONDITIONAL_REQUIREMENTS)) LOG.debug("@@@ Original requirement: {}", req);
            desugarer.desugarRequirement(req, desugaredRequirements, errors);
        }
        for (RequirementError error : errors) {
            map.addError(error);
            if (options.debug(CONDITIONAL_REQUIREMENTS)) LOG.debug("@@@ Invalid requirement: {}", error);
        }

        for (Requirement req : desugaredRequirements) {
            if (options.debug(CONDITIONAL_REQUIREMENTS)) LOG.debug("@@@ Desugared requirement: {}", req);

            if (req.kind() == RequirementKind.CONFORMANCE && !system.isKnownProtocol(req.protocol())) {
                addRulesForProtocol(req.protocol());
            }

            // TODO: record a rewrite path once conformance rules can be cited as proof steps
            Pair<MutableTerm, MutableTerm> rule = lowering.getRuleForRequirement(req, null, substitutions);
            system.addRule(rule.first(), rule.second(), null);
        }
    }

    private void addRulesForProtocol(ProtocolDecl protocol) {
        if (options.debug(CONDITIONAL_REQUIREMENTS)) LOG.debug("@@@ Unknown protocol: {}", protocol.name());

        RuleBuilder builder = new RuleBuilder(context, system.protocols());
        builder.addProtocol(protocol, false);
        builder.collectRulesFromReferencedProtocols();
        builder.addTo(system);
    }
}
