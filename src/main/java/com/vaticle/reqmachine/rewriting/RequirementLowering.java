/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.ProtocolDecl;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.collection.Pair;
import com.vaticle.reqmachine.common.exception.ReqMachineException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

/**
 * Converts desugared requirements into rewrite rules.
 */
public class RequirementLowering {

    private final RewriteContext context;

    public RequirementLowering(RewriteContext context) {
        this.context = context;
    }

    /**
     * Builds the rule for a requirement whose subject is a type parameter.
     * <p>
     * Without {@code substitutions}, type parameters are interpreted in the generic signature, or in the
     * requirement signature of {@code protocol} when it is given. With {@code substitutions}, the requirement's
     * generic parameters {@code τ_0_n} stand for the {@code n}th substitution term, as they do in the conditional
     * requirements of a concrete conformance.
     *
     * @return the pair {@code (lhs, rhs)}, not yet oriented
     */
    public Pair<MutableTerm, MutableTerm> getRuleForRequirement(Requirement req, @Nullable ProtocolDecl protocol,
                                                                @Nullable List<Term> substitutions) {
        MutableTerm subject = termFor(req.subject(), protocol, substitutions);
        switch (req.kind()) {
            case CONFORMANCE: {
                MutableTerm constraint = new MutableTerm(subject).add(Symbol.forProtocol(req.protocol()));
                return Pair.of(constraint, subject);
            }
            case SUPERCLASS: {
                List<Term> result = new ArrayList<>();
                Type schema = schemaFor(req.constraintType(), protocol, substitutions, result);
                MutableTerm constraint = new MutableTerm(subject).add(Symbol.forSuperclass(schema, result));
                return Pair.of(constraint, subject);
            }
            case LAYOUT: {
                MutableTerm constraint = new MutableTerm(subject).add(Symbol.forLayout(req.layout()));
                return Pair.of(constraint, subject);
            }
            case SAME_TYPE: {
                Type other = req.constraintType();
                if (other.isTypeParameter()) {
                    return Pair.of(subject, termFor(other, protocol, substitutions));
                }
                List<Term> result = new ArrayList<>();
                Type schema = schemaFor(other, protocol, substitutions, result);
                MutableTerm constraint = new MutableTerm(subject).add(Symbol.forConcreteType(schema, result));
                return Pair.of(constraint, subject);
            }
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    private MutableTerm termFor(Type type, @Nullable ProtocolDecl protocol, @Nullable List<Term> substitutions) {
        if (substitutions != null) return context.getRelativeTermForType(type, substitutions);
        else return context.getTermForType(type, protocol);
    }

    private Type schemaFor(Type type, @Nullable ProtocolDecl protocol, @Nullable List<Term> substitutions,
                           List<Term> result) {
        if (substitutions != null) return context.getRelativeSubstitutionSchemaFromType(type, substitutions, result);
        else return context.getSubstitutionSchemaFromType(type, protocol, result);
    }
}
