package com.agrisense.rule;

import com.agrisense.rule.RuleLibraryDocument.ActionDefinition;
import com.agrisense.rule.RuleLibraryDocument.ConditionDefinition;
import com.agrisense.rule.RuleLibraryDocument.RuleDefinition;
import com.agrisense.rule.RuleLibraryDocument.TestDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns library definitions into compiled {@link Rule}s, rejecting anything that
 * could not be evaluated: duplicate names, unknown operators, variables used
 * before any positive condition binds them, and retracts of undeclared aliases.
 */
class RuleCompiler {

    RuleLibrary compile(RuleLibraryDocument document) {
        requireNonNull(document, "rule library document is required");
        requireNonNull(document.rules(), "rules are required");

        Set<String> outputKinds = new LinkedHashSet<>();
        if (document.outputKinds() != null) {
            for (String kind : document.outputKinds()) {
                outputKinds.add(requireString(kind, "output_kinds must not contain blank kinds"));
            }
        }

        Set<String> names = new HashSet<>();
        List<Rule> rules = new ArrayList<>();
        for (RuleDefinition definition : document.rules()) {
            requireNonNull(definition, "rule definition must not be null");
            String name = requireString(definition.name(), "rule name is required");
            if (!names.add(name)) {
                throw new RuleLibraryException("duplicate rule name: " + name);
            }
            rules.add(compileRule(name, definition));
        }
        return new RuleLibrary(rules, outputKinds);
    }

    private Rule compileRule(String name, RuleDefinition definition) {
        List<ConditionDefinition> conditionDefs = definition.conditions();
        if (conditionDefs == null || conditionDefs.isEmpty()) {
            throw new RuleLibraryException(name + ": at least one condition is required");
        }
        List<ActionDefinition> actionDefs = definition.actions();
        if (actionDefs == null || actionDefs.isEmpty()) {
            throw new RuleLibraryException(name + ": at least one action is required");
        }

        Set<String> bound = new HashSet<>();
        Set<String> aliases = new HashSet<>();
        List<Condition> conditions = new ArrayList<>();
        for (ConditionDefinition conditionDef : conditionDefs) {
            requireNonNull(conditionDef, name + ": condition must not be null");
            conditions.add(compileCondition(name, conditionDef, bound, aliases));
        }

        List<Action> actions = new ArrayList<>();
        for (ActionDefinition actionDef : actionDefs) {
            requireNonNull(actionDef, name + ": action must not be null");
            actions.add(compileAction(name, actionDef, bound, aliases));
        }

        int priority = definition.priority() != null ? definition.priority() : 0;
        return new Rule(name, priority, definition.description(), conditions, actions);
    }

    private Condition compileCondition(String rule, ConditionDefinition def,
                                       Set<String> bound, Set<String> aliases) {
        String kind = requireString(def.kind(), rule + ": condition kind is required");
        boolean negated = Boolean.TRUE.equals(def.negated());

        String alias = def.alias();
        if (alias != null) {
            requireString(alias, rule + ": condition alias must not be blank");
            if (negated) {
                throw new RuleLibraryException(rule + ": negated condition on '" + kind + "' cannot carry an alias");
            }
            if (!aliases.add(alias)) {
                throw new RuleLibraryException(rule + ": duplicate alias '" + alias + "'");
            }
        }

        // variables first bound inside a negated condition stay local to it
        Set<String> scope = negated ? new HashSet<>(bound) : bound;
        List<Constraint> constraints = new ArrayList<>();
        if (def.match() != null) {
            for (Map.Entry<String, Object> entry : def.match().entrySet()) {
                constraints.add(compileConstraint(rule, entry.getKey(), Operator.EQ, entry.getValue(), scope));
            }
        }
        if (def.tests() != null) {
            for (TestDefinition test : def.tests()) {
                requireNonNull(test, rule + ": test must not be null");
                requireNonNull(test.op(), rule + ": test on '" + test.attribute() + "' requires an op");
                constraints.add(compileConstraint(rule, test.attribute(), test.op(), test.value(), scope));
            }
        }
        return new Condition(kind, alias, negated, constraints);
    }

    private Constraint compileConstraint(String rule, String attribute, Operator op,
                                         Object raw, Set<String> scope) {
        requireString(attribute, rule + ": constraint attribute is required");
        Term term = parseTerm(rule, attribute, raw);

        if (term instanceof Term.Variable variable) {
            if (op == Operator.EQ) {
                scope.add(variable.name());
            } else if (!scope.contains(variable.name())) {
                throw new RuleLibraryException(rule + ": variable " + variable
                    + " used with '" + op.getValue() + "' before it is bound");
            }
            if (op == Operator.IN) {
                throw new RuleLibraryException(rule + ": 'in' on '" + attribute + "' requires a list literal");
            }
        } else {
            Object value = ((Term.Literal) term).value();
            if (op.isOrdering() && !(value instanceof Number)) {
                throw new RuleLibraryException(rule + ": '" + op.getValue() + "' on '" + attribute
                    + "' requires a numeric value");
            }
            if (op == Operator.IN && (!(value instanceof List<?> list) || list.isEmpty())) {
                throw new RuleLibraryException(rule + ": 'in' on '" + attribute + "' requires a non-empty list");
            }
            if (op != Operator.IN && value instanceof List<?>) {
                throw new RuleLibraryException(rule + ": list value on '" + attribute
                    + "' is only allowed with 'in'");
            }
        }
        return new Constraint(attribute, op, term);
    }

    private Action compileAction(String rule, ActionDefinition def, Set<String> bound, Set<String> aliases) {
        requireNonNull(def.type(), rule + ": action type is required");
        return switch (def.type()) {
            case ASSERT -> {
                String kind = requireString(def.kind(), rule + ": assert action kind is required");
                Map<String, Term> attributes = new LinkedHashMap<>();
                if (def.attributes() != null) {
                    for (Map.Entry<String, Object> entry : def.attributes().entrySet()) {
                        String attribute = requireString(entry.getKey(), rule + ": asserted attribute name is required");
                        Term term = parseTerm(rule, attribute, entry.getValue());
                        if (term instanceof Term.Variable variable && !bound.contains(variable.name())) {
                            throw new RuleLibraryException(rule + ": action uses unbound variable " + variable);
                        }
                        if (term instanceof Term.Literal literal && literal.value() instanceof List<?>) {
                            throw new RuleLibraryException(rule + ": asserted attribute '" + attribute
                                + "' must be a scalar");
                        }
                        attributes.put(attribute, term);
                    }
                }
                yield new Action.AssertFact(kind, attributes);
            }
            case RETRACT -> {
                String alias = requireString(def.fact(), rule + ": retract action requires 'fact'");
                if (!aliases.contains(alias)) {
                    throw new RuleLibraryException(rule + ": retract references undeclared alias '" + alias + "'");
                }
                yield new Action.RetractFact(alias);
            }
        };
    }

    private Term parseTerm(String rule, String attribute, Object raw) {
        Term term;
        try {
            term = Term.parse(attribute, raw);
        } catch (IllegalArgumentException ex) {
            throw new RuleLibraryException(rule + ": " + ex.getMessage(), ex);
        }
        if (term instanceof Term.Variable variable && variable.name().isBlank()) {
            throw new RuleLibraryException(rule + ": variable name on '" + attribute + "' must not be empty");
        }
        return term;
    }

    private String requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new RuleLibraryException(message);
        }
        return value;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new RuleLibraryException(message);
        }
    }
}
