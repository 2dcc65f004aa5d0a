package org.flowvault.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a {@link FilterNode} tree into a parameterized SQL predicate.
 * <p>
 * Each leaf contributes its field's template and at most one parameter. Composite nodes
 * parenthesize every child, so the SQL precedence always matches the tree shape regardless
 * of what the children contain. Parameters are concatenated in the order their placeholders
 * appear in the fragment: children left to right, depth-first.
 * <p>
 * Compilation is pure; compiling the same tree twice yields equal predicates.
 */
public class FilterCompiler implements IFilterNodeVisitor<CompiledPredicate> {

    /**
     * Compiles a filter tree.
     *
     * @param node the tree root
     * @return fragment and parameters
     */
    public CompiledPredicate compile(FilterNode node) {
        return node.accept(this);
    }

    @Override
    public CompiledPredicate visitUnary(FilterNode.Unary node) {
        return new CompiledPredicate(node.field().sql(), List.of());
    }

    @Override
    public CompiledPredicate visitRegexMatch(FilterNode.RegexMatch node) {
        return new CompiledPredicate(node.field().sql(), List.of(node.pattern()));
    }

    @Override
    public CompiledPredicate visitIntCompare(FilterNode.IntCompare node) {
        return new CompiledPredicate(node.field().sql(), List.of(node.value()));
    }

    @Override
    public CompiledPredicate visitAnd(FilterNode.And node) {
        return join(node.children(), " AND ");
    }

    @Override
    public CompiledPredicate visitOr(FilterNode.Or node) {
        return join(node.children(), " OR ");
    }

    @Override
    public CompiledPredicate visitNot(FilterNode.Not node) {
        CompiledPredicate inner = node.child().accept(this);
        return new CompiledPredicate("NOT (" + inner.fragment() + ")", inner.params());
    }

    private CompiledPredicate join(List<FilterNode> children, String operator) {
        StringBuilder fragment = new StringBuilder();
        List<Object> params = new ArrayList<>();
        for (FilterNode child : children) {
            CompiledPredicate compiled = child.accept(this);
            if (fragment.length() > 0) {
                fragment.append(operator);
            }
            fragment.append('(').append(compiled.fragment()).append(')');
            params.addAll(compiled.params());
        }
        return new CompiledPredicate(fragment.toString(), params);
    }
}
