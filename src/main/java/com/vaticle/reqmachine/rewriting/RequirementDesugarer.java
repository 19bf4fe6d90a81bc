/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.rewriting;

import com.vaticle.reqmachine.ast.NominalType;
import com.vaticle.reqmachine.ast.Requirement;
import com.vaticle.reqmachine.ast.Type;
import com.vaticle.reqmachine.common.exception.ReqMachineException;
import com.vaticle.reqmachine.conformance.ConformanceLookup;
import com.vaticle.reqmachine.conformance.ProtocolConformanceRef;

import java.util.List;
import java.util.Optional;

import static com.vaticle.reqmachine.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Requirement.CONFLICTING_CONFORMANCE;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Requirement.CONFLICTING_LAYOUT;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Requirement.CONFLICTING_SAME_TYPE;
import static com.vaticle.reqmachine.common.exception.ErrorMessage.Requirement.CONFLICTING_SUPERCLASS;

/**
 * Breaks requirements down until every remaining one has a type parameter as its subject. Requirements on concrete
 * types are checked instead, and dropped when they hold.
 */
public class RequirementDesugarer {

    private final ConformanceLookup conformances;

    public RequirementDesugarer(ConformanceLookup conformances) {
        this.conformances = conformances;
    }

    public void desugarRequirement(Requirement req, List<Requirement> result, List<RequirementError> errors) {
        switch (req.kind()) {
            case CONFORMANCE:
                desugarConformance(req, result, errors);
                break;
            case SUPERCLASS:
                desugarSuperclass(req, result, errors);
                break;
            case LAYOUT:
                desugarLayout(req, result, errors);
                break;
            case SAME_TYPE:
                desugarSameType(req.subject(), req.constraintType(), req, result, errors);
                break;
            default:
                throw ReqMachineException.of(ILLEGAL_STATE);
        }
    }

    private void desugarConformance(Requirement req, List<Requirement> result, List<RequirementError> errors) {
        Type subject = req.subject();
        if (subject.isTypeParameter()) {
            result.add(req);
            return;
        }
        if (subject.isError()) return;

        ProtocolConformanceRef conformance = conformances.lookupConformance(subject, req.protocol());
        if (!conformance.isConcrete()) {
            errors.add(new RequirementError(CONFLICTING_CONFORMANCE, req, subject, req.protocol()));
            return;
        }
        for (Requirement conditional : conformance.getConcrete().getConditionalRequirements()) {
            desugarRequirement(conditional, result, errors);
        }
    }

    private void desugarSuperclass(Requirement req, List<Requirement> result, List<RequirementError> errors) {
        Type subject = req.subject();
        if (subject.isTypeParameter()) {
            result.add(req);
            return;
        }
        Type superclass = req.constraintType();
        if (subject.isError() || superclass.isError()) return;

        if (subject.isNominal() && superclass.isNominal()) {
            Optional<Type> current = Optional.of(subject);
            while (current.isPresent() && current.get().isNominal()) {
                NominalType candidate = current.get().asNominal();
                if (candidate.decl().equals(superclass.asNominal().decl())) {
                    desugarSameType(candidate, superclass, req, result, errors);
                    return;
                }
                current = candidate.superclass();
            }
        }
        errors.add(new RequirementError(CONFLICTING_SUPERCLASS, req, subject, superclass));
    }

    private void desugarLayout(Requirement req, List<Requirement> result, List<RequirementError> errors) {
        Type subject = req.subject();
        if (subject.isTypeParameter()) {
            result.add(req);
            return;
        }
        if (subject.isError()) return;
        if (!subject.isNominal() || !req.layout().isSatisfiedBy(subject.asNominal())) {
            errors.add(new RequirementError(CONFLICTING_LAYOUT, req, subject, req.layout()));
        }
    }

    private void desugarSameType(Type first, Type second, Requirement original, List<Requirement> result,
                                 List<RequirementError> errors) {
        if (first.isError() || second.isError() || first.equals(second)) return;

        if (first.isTypeParameter()) {
            result.add(Requirement.sameType(first, second));
        } else if (second.isTypeParameter()) {
            result.add(Requirement.sameType(second, first));
        } else if (first.isNominal() && second.isNominal() &&
                first.asNominal().decl().equals(second.asNominal().decl())) {
            List<Type> firstArgs = first.asNominal().args();
            List<Type> secondArgs = second.asNominal().args();
            for (int i = 0; i < firstArgs.size(); i++) {
                desugarSameType(firstArgs.get(i), secondArgs.get(i), original, result, errors);
            }
        } else {
            errors.add(new RequirementError(CONFLICTING_SAME_TYPE, original, first, second));
        }
    }
}
