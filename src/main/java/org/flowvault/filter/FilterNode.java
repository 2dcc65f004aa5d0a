package org.flowvault.filter;

import java.util.List;
import java.util.Objects;

/**
 * A node of a parsed flow filter expression.
 * <p>
 * Leaves test one field of a flow; {@link And}, {@link Or} and {@link Not} combine them.
 * Nodes are immutable values: two trees built from the same expression are equal.
 */
public sealed interface FilterNode
        permits FilterNode.Unary, FilterNode.RegexMatch, FilterNode.IntCompare,
                FilterNode.And, FilterNode.Or, FilterNode.Not {

    <R> R accept(IFilterNodeVisitor<R> visitor);

    /**
     * Compiles this expression into a SQL predicate over the flow view.
     *
     * @return the predicate fragment and its parameters
     */
    default CompiledPredicate compile() {
        return accept(new FilterCompiler());
    }

    /**
     * A flag without argument, such as {@code ~marked}.
     */
    record Unary(FilterField field) implements FilterNode {
        public Unary {
            Objects.requireNonNull(field, "field cannot be null");
            if (field.arity() != FilterField.Arity.NONE) {
                throw new IllegalArgumentException("~" + field.code() + " takes an argument");
            }
        }

        @Override
        public <R> R accept(IFilterNodeVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * A flag with a regular expression argument, such as {@code ~h "^Host"}.
     */
    record RegexMatch(FilterField field, String pattern) implements FilterNode {
        public RegexMatch {
            Objects.requireNonNull(field, "field cannot be null");
            Objects.requireNonNull(pattern, "pattern cannot be null");
            if (field.arity() != FilterField.Arity.REGEX) {
                throw new IllegalArgumentException("~" + field.code() + " does not take a regex");
            }
        }

        @Override
        public <R> R accept(IFilterNodeVisitor<R> visitor) {
            return visitor.visitRegexMatch(this);
        }
    }

    /**
     * A flag with an integer argument, such as {@code ~c 200}.
     */
    record IntCompare(FilterField field, long value) implements FilterNode {
        public IntCompare {
            Objects.requireNonNull(field, "field cannot be null");
            if (field.arity() != FilterField.Arity.INTEGER) {
                throw new IllegalArgumentException("~" + field.code() + " does not take an integer");
            }
        }

        @Override
        public <R> R accept(IFilterNodeVisitor<R> visitor) {
            return visitor.visitIntCompare(this);
        }
    }

    /** Conjunction of at least two expressions. */
    record And(List<FilterNode> children) implements FilterNode {
        public And {
            children = List.copyOf(children);
            if (children.size() < 2) {
                throw new IllegalArgumentException("And needs at least two children");
            }
        }

        @Override
        public <R> R accept(IFilterNodeVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    /** Disjunction of at least two expressions. */
    record Or(List<FilterNode> children) implements FilterNode {
        public Or {
            children = List.copyOf(children);
            if (children.size() < 2) {
                throw new IllegalArgumentException("Or needs at least two children");
            }
        }

        @Override
        public <R> R accept(IFilterNodeVisitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Not(FilterNode child) implements FilterNode {
        public Not {
            Objects.requireNonNull(child, "child cannot be null");
        }

        @Override
        public <R> R accept(IFilterNodeVisitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }
}
