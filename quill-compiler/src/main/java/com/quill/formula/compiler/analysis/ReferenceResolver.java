/*
 * Copyright (c) 2025 Quill Formula Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.quill.formula.compiler.analysis;

import com.quill.formula.api.ast.BinaryOp;
import com.quill.formula.api.ast.Call;
import com.quill.formula.api.ast.Conditional;
import com.quill.formula.api.ast.FieldReference;
import com.quill.formula.api.ast.FormulaNode;
import com.quill.formula.api.ast.FormulaNodeVisitor;
import com.quill.formula.api.ast.Literal;
import com.quill.formula.api.ast.UnaryOp;
import com.quill.formula.api.model.SchemaSnapshot;
import com.quill.formula.api.model.UnresolvedReference;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the fields a formula reads and checks that each belongs to the
 * formula's own entity.
 */
public final class ReferenceResolver {

    /**
     * Every field reference, in source order, duplicates included.
     */
    public List<FieldReference> references(FormulaNode ast) {
        List<FieldReference> found = new ArrayList<>();
        ast.accept(new Collector(found));
        return found;
    }

    /**
     * Distinct referenced field ids, sorted.
     */
    public SortedSet<String> fieldIds(FormulaNode ast) {
        SortedSet<String> ids = new TreeSet<>();
        for (FieldReference reference : references(ast)) {
            ids.add(reference.fieldId());
        }
        return ids;
    }

    /**
     * Reports each distinct field id that is unknown or owned by another
     * entity, at its first occurrence.
     */
    public List<UnresolvedReference> resolve(FormulaNode ast, SchemaSnapshot snapshot) {
        Map<String, FieldReference> firstOccurrence = new LinkedHashMap<>();
        for (FieldReference reference : references(ast)) {
            firstOccurrence.putIfAbsent(reference.fieldId(), reference);
        }
        List<UnresolvedReference> unresolved = new ArrayList<>();
        for (FieldReference reference : firstOccurrence.values()) {
            String fieldId = reference.fieldId();
            if (snapshot.contains(fieldId)) {
                continue;
            }
            if (snapshot.isForeign(fieldId)) {
                unresolved.add(new UnresolvedReference(fieldId, reference.span(), UnresolvedReference.Reason.CROSS_ENTITY,
                        "Field '" + fieldId + "' belongs to another entity; only fields of '"
                            + snapshot.entityId() + "' can be referenced"));
            } else {
                unresolved.add(new UnresolvedReference(fieldId, reference.span(), UnresolvedReference.Reason.UNKNOWN_FIELD,
                        "Unknown field '" + fieldId + "'"));
            }
        }
        return unresolved;
    }

    private static final class Collector implements FormulaNodeVisitor<Void> {
        private final List<FieldReference> found;

        Collector(List<FieldReference> found) {
            this.found = found;
        }

        @Override
        public Void visitLiteral(Literal literal) {
            return null;
        }

        @Override
        public Void visitFieldReference(FieldReference reference) {
            found.add(reference);
            return null;
        }

        @Override
        public Void visitBinary(BinaryOp binary) {
            binary.left().accept(this);
            binary.right().accept(this);
            return null;
        }

        @Override
        public Void visitUnary(UnaryOp unary) {
            unary.operand().accept(this);
            return null;
        }

        @Override
        public Void visitCall(Call call) {
            call.arguments().forEach(argument -> argument.accept(this));
            return null;
        }

        @Override
        public Void visitConditional(Conditional conditional) {
            conditional.condition().accept(this);
            conditional.thenBranch().accept(this);
            conditional.elseBranch().accept(this);
            return null;
        }
    }
}
