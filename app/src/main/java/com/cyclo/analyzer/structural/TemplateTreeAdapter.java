package com.cyclo.analyzer.structural;

import com.cyclo.analyzer.core.UnsupportedConstructException;
import com.cyclo.analyzer.template.Expression;
import com.cyclo.analyzer.template.ForNode;
import com.cyclo.analyzer.template.IfNode;
import com.cyclo.analyzer.template.Output;
import com.cyclo.analyzer.template.ScopedBlockNode;
import com.cyclo.analyzer.template.SetBlockNode;
import com.cyclo.analyzer.template.SetNode;
import com.cyclo.analyzer.template.TemplateData;
import com.cyclo.analyzer.template.TemplateNode;
import com.cyclo.analyzer.template.TemplateNodeVisitor;
import com.cyclo.analyzer.template.TemplateRoot;
import com.cyclo.analyzer.template.UnmodeledTag;

import java.util.List;
import java.util.Optional;

/**
 * Classifies parsed template nodes for the {@link CfgBuilder}.
 * <p>
 * {@code if} is a conditional whose elif branches are its alternatives,
 * {@code for} is a loop whose {@code else} body is the empty case, everything
 * else that is modelled runs its body in order. Filtered and recursive loops and
 * every {@link UnmodeledTag} are rejected.
 */
public class TemplateTreeAdapter implements SyntaxTreeAdapter<TemplateNode> {

    private final Classifier classifier = new Classifier();

    @Override
    public NodeShape<TemplateNode> classify(TemplateNode node) throws UnsupportedConstructException {
        return node.accept(classifier);
    }

    @Override
    public String describe(TemplateNode node) {
        return node.describe();
    }

    @Override
    public int lineOf(TemplateNode node) {
        return node.line();
    }

    private static NodeShape<TemplateNode> simple(List<TemplateNode> children) {
        return new NodeShape.Simple<>(children);
    }

    private static final class Classifier
            implements TemplateNodeVisitor<NodeShape<TemplateNode>, UnsupportedConstructException> {

        @Override
        public NodeShape<TemplateNode> visitRoot(TemplateRoot node) {
            return simple(node.body());
        }

        @Override
        public NodeShape<TemplateNode> visitOutput(Output node) {
            return simple(node.items());
        }

        @Override
        public NodeShape<TemplateNode> visitData(TemplateData node) {
            return simple(List.of());
        }

        @Override
        public NodeShape<TemplateNode> visitExpression(Expression node) {
            return simple(List.of());
        }

        @Override
        public NodeShape<TemplateNode> visitIf(IfNode node) {
            List<TemplateNode> alternatives = List.copyOf(node.elifs());
            return new NodeShape.Conditional<>(node.body(), alternatives, node.elseBranch());
        }

        @Override
        public NodeShape<TemplateNode> visitFor(ForNode node) throws UnsupportedConstructException {
            if (node.recursive()) {
                throw new UnsupportedConstructException("for ... recursive", node.line());
            }
            if (node.loopFilter().isPresent()) {
                throw new UnsupportedConstructException("for ... if " + node.filter(), node.line());
            }
            return new NodeShape.Loop<>(node.body(), node.elseBranch());
        }

        @Override
        public NodeShape<TemplateNode> visitSet(SetNode node) {
            return simple(List.of());
        }

        @Override
        public NodeShape<TemplateNode> visitSetBlock(SetBlockNode node) {
            return simple(node.body());
        }

        @Override
        public NodeShape<TemplateNode> visitScopedBlock(ScopedBlockNode node) {
            return simple(node.body());
        }

        @Override
        public NodeShape<TemplateNode> visitUnmodeled(UnmodeledTag node) throws UnsupportedConstructException {
            throw new UnsupportedConstructException(node.tag(), node.line());
        }
    }
}
